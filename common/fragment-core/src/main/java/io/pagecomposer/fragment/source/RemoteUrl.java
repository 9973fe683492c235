package io.pagecomposer.fragment.source;

import io.pagecomposer.fragment.RenderContext;
import java.net.URI;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * A remote url composed of a base and an optional relative part. The relative part is either a fixed
 * path template or a function of the request context and the base.
 * <p>
 * The {@code authorization} value is not used here; fetchers normally send it as the
 * {@code Authorization} header for requests to this url.
 */
public final class RemoteUrl implements SourceLocator {

    private final String base;
    private final String relative;
    private final BiFunction<RenderContext, String, String> relativeFunction;
    private final String authorization;

    public RemoteUrl(String base, String relative, String authorization) {
        this.base = requireBase(base);
        this.relative = relative;
        this.relativeFunction = null;
        this.authorization = authorization;
    }

    public RemoteUrl(String base, BiFunction<RenderContext, String, String> relative, String authorization) {
        this.base = requireBase(base);
        this.relative = null;
        this.relativeFunction = Objects.requireNonNull(relative, "relative");
        this.authorization = authorization;
    }

    /**
     * Resolves the full url. Path sections starting with {@code :} are replaced by the matching
     * request parameter; encode the colon if it has to survive.
     */
    public String resolve(RenderContext context) {
        RenderContext safeContext = context == null ? RenderContext.empty() : context;
        String template = relativeFunction != null ? relativeFunction.apply(safeContext, base) : relative;
        if (template == null || template.isEmpty()) {
            return base;
        }
        return URI.create(base).resolve(PathParameters.apply(template, safeContext.params())).toString();
    }

    public String base() {
        return base;
    }

    public String authorization() {
        return authorization;
    }

    @Override
    public String toString() {
        Object rel = relativeFunction != null ? "<function>" : relative;
        return "Url.Remote(" + base + ", " + rel + ", " + (authorization == null ? "-" : "***") + ")";
    }

    private static String requireBase(String base) {
        Objects.requireNonNull(base, "base");
        if (base.isBlank()) {
            throw new IllegalArgumentException("base url must not be blank");
        }
        return base.trim();
    }
}
