package io.pagecomposer.fragment.render;

import io.pagecomposer.fragment.FragmentBody;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.Route;
import io.pagecomposer.fragment.error.FragmentException;
import io.pagecomposer.templating.TemplateRenderer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link Route}: fetches its base fragment and expands every injection marker, fetching the
 * fragments they need through the supplied {@link FragmentFetcher}.
 * <p>
 * The fetcher receives the fragment, the request's {@link RenderContext} and
 * {@link io.pagecomposer.fragment.FetchOptions}, and returns a future {@link FragmentBody}.
 */
public final class FragmentComposer {

    private static final Logger log = LoggerFactory.getLogger(FragmentComposer.class);

    private final TemplateRenderer templateRenderer;

    public FragmentComposer(TemplateRenderer templateRenderer) {
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer");
    }

    /**
     * Starts rendering {@code route}. The returned future fails with the exact error that aborted the
     * render (a fetcher error of a required fragment, or a {@link FragmentException}); the route's
     * error hook is notified first.
     */
    public CompletableFuture<FragmentBody> render(Route route, FragmentFetcher fetcher, RenderContext context) {
        Objects.requireNonNull(route, "route");
        RenderContext safeContext = context == null ? RenderContext.empty() : context;
        CompletableFuture<FragmentBody> result = new CompletableFuture<>();
        CompletableFuture<FragmentBody> pipeline;
        try {
            FragmentManager manager = new FragmentManager(route, fetcher, safeContext);
            Renderer renderer = new Renderer(manager, templateRenderer);
            pipeline = manager.fetchBase().thenCompose(base -> {
                if (base.body() != null && !(base.body() instanceof CharSequence)) {
                    return CompletableFuture.completedFuture(base);
                }
                String text = base.body() == null ? null : base.body().toString();
                return renderer.renderRecursive(text, 1)
                    .thenApply(body -> new FragmentBody(body, base.contentType()));
            });
        } catch (RuntimeException ex) {
            pipeline = CompletableFuture.failedFuture(ex);
        }
        pipeline.whenComplete((body, error) -> {
            if (error == null) {
                result.complete(body);
                return;
            }
            Throwable cause = FanOut.unwrap(error);
            log.error("Rendering of route {} {} failed: {}", route.method(), route.path(), cause.getMessage());
            try {
                route.onError(cause, safeContext);
            } catch (RuntimeException hookError) {
                cause.addSuppressed(hookError);
            }
            result.completeExceptionally(cause);
        });
        return result;
    }

    /**
     * Blocking variant of {@link #render}. Unchecked failures are rethrown as is; checked ones raised by
     * a fetcher are wrapped in a {@link FragmentException}.
     */
    public FragmentBody renderNow(Route route, FragmentFetcher fetcher, RenderContext context) {
        try {
            return render(route, fetcher, context).join();
        } catch (CompletionException ex) {
            Throwable cause = FanOut.unwrap(ex);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new FragmentException(cause);
        }
    }
}
