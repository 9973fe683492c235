package io.pagecomposer.fragment;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a {@link Fragment} into bytes. Supplied by the caller of a render.
 * <p>
 * Failures of non-required fragments are expected to be converted into a fallback body
 * (usually {@link Fragment#contentMissingMessage(Throwable)}) unless
 * {@link FetchOptions#failFast()} is set; failures of required fragments must complete
 * the returned future exceptionally.
 */
@FunctionalInterface
public interface FragmentFetcher {

    CompletableFuture<FragmentBody> fetch(Fragment fragment, RenderContext context, FetchOptions options);
}
