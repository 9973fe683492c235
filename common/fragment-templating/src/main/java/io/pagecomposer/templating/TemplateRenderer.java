package io.pagecomposer.templating;

import java.util.Map;

/**
 * Small, engine-agnostic templating API used to evaluate fragment templates once every
 * nested injection has been expanded.
 * <p>
 * Implementations are expected to be thread-safe.
 */
@FunctionalInterface
public interface TemplateRenderer {

    /**
     * Renders the given {@code template} using the supplied context map.
     *
     * @param template non-null template source
     * @param context  rendering context (may be {@code null}, treated as empty)
     * @return rendered template result
     * @throws TemplateRenderingException when rendering fails
     */
    String render(String template, Map<String, Object> context);
}
