package io.pagecomposer.fragment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Configures one endpoint of the aggregator: either a composed page (a base fragment plus the named
 * fragments it may inject) or a redirect.
 *
 * <pre>{@code
 * Route route = Route.builder()
 *     .path("/this/is/a/:route")
 *     .responseHeader("X-Greeting", context -> "Hello " + context.params().get("route"))
 *     .responseHeader("X-Static-Info", "this is the same for everyone")
 *     .baseFragment(baseFragment)
 *     .fragment("part1", fragment1)
 *     .fragment("part2", fragment2)
 *     .build();
 * }</pre>
 */
public final class Route {

    private final String path;
    private final String method;
    private final Map<String, Function<RenderContext, String>> responseHeaders;
    private final FragmentFactory baseFragment;
    private final Map<String, FragmentFactory> fragments;
    private final Predicate<RenderContext> onRequest;
    private final BiConsumer<Throwable, RenderContext> onError;
    private final Long cacheMaxAge;
    private final String redirect;

    private Route(Builder builder) {
        this.path = builder.path;
        this.method = builder.method == null ? "GET" : builder.method.trim().toUpperCase(Locale.ROOT);
        this.responseHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.responseHeaders));
        this.baseFragment = builder.baseFragment;
        this.fragments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fragments));
        this.onRequest = builder.onRequest;
        this.onError = builder.onError;
        this.cacheMaxAge = builder.cacheMaxAge;
        this.redirect = builder.redirect;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String path() {
        return path;
    }

    /**
     * @return the HTTP method this endpoint responds on, upper case, {@code GET} by default
     */
    public String method() {
        return method;
    }

    /**
     * The first fragment fetched and rendered for a request, {@code null} for redirect routes.
     */
    public FragmentFactory baseFragment() {
        return baseFragment;
    }

    /**
     * Named fragments available to injection tags, in declaration order.
     */
    public Map<String, FragmentFactory> fragments() {
        return fragments;
    }

    public Long cacheMaxAge() {
        return cacheMaxAge;
    }

    public String redirect() {
        return redirect;
    }

    public boolean isRedirect() {
        return redirect != null;
    }

    /**
     * Runs the request hook. Returning {@code false} cancels processing of the request with this route.
     */
    public boolean onRequest(RenderContext context) {
        return onRequest == null || onRequest.test(context);
    }

    /**
     * Notifies the error hook, if any, of a failed render.
     */
    public void onError(Throwable error, RenderContext context) {
        if (onError != null) {
            onError.accept(error, context);
        }
    }

    /**
     * Evaluates the configured response headers for one request.
     */
    public Map<String, String> responseHeaders(RenderContext context) {
        Map<String, String> resolved = new LinkedHashMap<>();
        responseHeaders.forEach((name, value) -> {
            String headerValue = value.apply(context);
            if (headerValue != null) {
                resolved.put(name, headerValue);
            }
        });
        return resolved;
    }

    @Override
    public String toString() {
        String f = fragments.isEmpty()
            ? "-"
            : fragments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
        return "Route(path: " + method + " " + path + ", template: " + baseFragment + ", fragments: " + f + ")";
    }

    public static final class Builder {
        private String path;
        private String method;
        private final Map<String, Function<RenderContext, String>> responseHeaders = new LinkedHashMap<>();
        private FragmentFactory baseFragment;
        private final Map<String, FragmentFactory> fragments = new LinkedHashMap<>();
        private Predicate<RenderContext> onRequest;
        private BiConsumer<Throwable, RenderContext> onError;
        private Consumer<Route> onCreate;
        private Long cacheMaxAge;
        private String redirect;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder responseHeader(String name, String value) {
            Objects.requireNonNull(value, "value");
            responseHeaders.put(name, context -> value);
            return this;
        }

        public Builder responseHeader(String name, Function<RenderContext, String> value) {
            responseHeaders.put(name, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder baseFragment(FragmentFactory baseFragment) {
            this.baseFragment = baseFragment;
            return this;
        }

        public Builder fragment(String name, FragmentFactory fragment) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(fragment, "fragment");
            if (fragments.putIfAbsent(name, fragment) != null) {
                throw new IllegalArgumentException("Duplicate fragment name " + name);
            }
            return this;
        }

        public Builder fragments(Map<String, FragmentFactory> fragments) {
            fragments.forEach(this::fragment);
            return this;
        }

        public Builder onRequest(Predicate<RenderContext> onRequest) {
            this.onRequest = onRequest;
            return this;
        }

        public Builder onError(BiConsumer<Throwable, RenderContext> onError) {
            this.onError = onError;
            return this;
        }

        /**
         * Hook executed once when the route is built.
         */
        public Builder onCreate(Consumer<Route> onCreate) {
            this.onCreate = onCreate;
            return this;
        }

        /**
         * {@code max-age} directive for the {@code Cache-Control} header, in seconds.
         */
        public Builder cacheMaxAge(Long cacheMaxAge) {
            this.cacheMaxAge = cacheMaxAge;
            return this;
        }

        public Builder redirect(String redirect) {
            this.redirect = redirect;
            return this;
        }

        public Route build() {
            if ((baseFragment == null) == (redirect == null)) {
                throw new IllegalStateException("A route needs exactly one of a base fragment or a redirect");
            }
            Route route = new Route(this);
            if (onCreate != null) {
                onCreate.accept(route);
            }
            return route;
        }
    }
}
