package io.pagecomposer.templating;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TemplateRenderer} backed by the Pebble templating engine.
 * <p>
 * This implementation uses {@link PebbleEngine#getLiteralTemplate(String)} so templates are provided
 * inline rather than loaded from files. The default engine runs with strict variables so that a
 * template reading a field of missing data fails instead of rendering blanks, and without
 * auto-escaping since fragment bodies are already markup.
 * <p>
 * The default engine keeps no template cache. Templates reaching this renderer carry fetched
 * fragment content, so each one is effectively unique and a cache keyed by source would only grow.
 */
public final class PebbleTemplateRenderer implements TemplateRenderer {

    private final PebbleEngine engine;

    public PebbleTemplateRenderer() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public PebbleTemplateRenderer(ObjectMapper mapper) {
        this(defaultEngine(mapper));
    }

    public PebbleTemplateRenderer(PebbleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public String render(String templateSource, Map<String, Object> context) {
        Objects.requireNonNull(templateSource, "templateSource");
        Map<String, Object> safeContext = context == null ? Map.of() : context;
        try {
            PebbleTemplate template = engine.getLiteralTemplate(templateSource);
            try (Writer writer = new StringWriter()) {
                template.evaluate(writer, safeContext);
                return writer.toString();
            }
        } catch (PebbleException | IOException ex) {
            throw new TemplateRenderingException("Failed to render template", ex);
        }
    }

    static PebbleEngine defaultEngine(ObjectMapper mapper) {
        return new PebbleEngine.Builder()
            .extension(new PebbleJsonExtension(mapper))
            .autoEscaping(false)
            .strictVariables(true)
            .cacheActive(false)
            .build();
    }
}
