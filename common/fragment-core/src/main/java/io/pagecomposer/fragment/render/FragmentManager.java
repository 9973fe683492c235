package io.pagecomposer.fragment.render;

import io.pagecomposer.fragment.FetchOptions;
import io.pagecomposer.fragment.Fragment;
import io.pagecomposer.fragment.FragmentBody;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.Route;
import io.pagecomposer.fragment.error.UnknownFragmentReferenceException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Request scoped registry of the fragments of a {@link Route}. Every fragment is instantiated once,
 * when the manager is created; fetches are not cached and always go through the fetcher with the
 * same {@link RenderContext}.
 */
public final class FragmentManager {

    private final Route route;
    private final FragmentFetcher fetcher;
    private final RenderContext context;
    private final Fragment baseFragment;
    private final Map<String, Fragment> sourceFragments;

    public FragmentManager(Route route, FragmentFetcher fetcher, RenderContext context) {
        this.route = Objects.requireNonNull(route, "route");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.context = context == null ? RenderContext.empty() : context;
        if (route.baseFragment() == null) {
            throw new IllegalArgumentException("Route " + route.path() + " has no base fragment to render");
        }
        this.baseFragment = route.baseFragment().create();
        Map<String, Fragment> fragments = new LinkedHashMap<>();
        route.fragments().forEach((name, factory) -> fragments.put(name, factory.create()));
        this.sourceFragments = Collections.unmodifiableMap(fragments);
    }

    public CompletableFuture<FragmentBody> fetchBase() {
        return invoke(baseFragment, FetchOptions.defaults());
    }

    public CompletableFuture<Object> baseBody() {
        return fetchBase().thenApply(FragmentBody::body);
    }

    public CompletableFuture<String> baseContentType() {
        return fetchBase().thenApply(FragmentBody::contentType);
    }

    /**
     * Fetches a fragment that is not necessarily part of the route, such as an embedded template.
     */
    public CompletableFuture<Object> fetchFragmentBody(Fragment fragment) {
        return fetchFragmentBody(fragment, FetchOptions.defaults());
    }

    public CompletableFuture<Object> fetchFragmentBody(Fragment fragment, FetchOptions options) {
        return invoke(fragment, options).thenApply(FragmentBody::body);
    }

    public CompletableFuture<Object> fragmentBody(String name) {
        return fragmentBody(name, FetchOptions.defaults());
    }

    public CompletableFuture<Object> fragmentBody(String name, FetchOptions options) {
        Fragment fragment = sourceFragments.get(name);
        if (fragment == null) {
            return CompletableFuture.failedFuture(new UnknownFragmentReferenceException(name));
        }
        return fetchFragmentBody(fragment, options);
    }

    public Fragment fragment(String name) {
        return sourceFragments.get(name);
    }

    public boolean hasFragment(String name) {
        return name != null && sourceFragments.containsKey(name);
    }

    public Route route() {
        return route;
    }

    public RenderContext context() {
        return context;
    }

    private CompletableFuture<FragmentBody> invoke(Fragment fragment, FetchOptions options) {
        Objects.requireNonNull(fragment, "fragment");
        CompletableFuture<FragmentBody> pending;
        try {
            pending = fetcher.fetch(fragment, context, options);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (pending == null) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Fragment fetcher returned no result for " + fragment));
        }
        return pending;
    }
}
