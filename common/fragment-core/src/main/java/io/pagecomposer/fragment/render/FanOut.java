package io.pagecomposer.fragment.render;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Join helpers for batches of already launched futures.
 */
final class FanOut {

    private FanOut() {
    }

    /**
     * Completes once every future has settled. Results keep the order of {@code futures}; when some
     * failed, the first failure in that order is reported, never the first to complete.
     */
    static <T> CompletableFuture<List<T>> joinAll(List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> {
                List<T> results = new ArrayList<>(futures.size());
                for (CompletableFuture<T> future : futures) {
                    results.add(future.join());
                }
                return results;
            });
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
