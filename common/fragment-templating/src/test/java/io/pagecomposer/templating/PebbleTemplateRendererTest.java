package io.pagecomposer.templating;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mitchellbosecke.pebble.PebbleEngine;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PebbleTemplateRendererTest {

    private final TemplateRenderer renderer = new PebbleTemplateRenderer();

    @Test
    void rendersStaticTemplate() {
        String result = renderer.render("hello", Map.of());
        assertThat(result).isEqualTo("hello");
    }

    @Test
    void rendersTemplateWithVariables() {
        String template = "Hello {{ name }}, count={{ count }}";
        String result = renderer.render(template, Map.of("name", "PageComposer", "count", 3));
        assertThat(result).isEqualTo("Hello PageComposer, count=3");
    }

    @Test
    void treatsNullContextAsEmpty() {
        assertThat(renderer.render("<p>static</p>", null)).isEqualTo("<p>static</p>");
    }

    @Test
    void supportsConditionalsAndLoops() {
        Map<String, Object> model = Map.of("items", List.of("a", "b"), "show", true);
        String template = "{% if model.show %}{% for item in model.items %}[{{ item }}]{% endfor %}{% endif %}";

        String result = renderer.render(template, Map.of("model", model));

        assertThat(result).isEqualTo("[a][b]");
    }

    @Test
    void doesNotEscapeMarkup() {
        String result = renderer.render("{{ html }}", Map.of("html", "<b>bold</b>"));
        assertThat(result).isEqualTo("<b>bold</b>");
    }

    @Test
    void jsonFilterSerialisesStructuredValues() {
        String result = renderer.render("{{ data | json }}", Map.of("data", Map.of("id", 7)));
        assertThat(result).isEqualTo("{\"id\":7}");
    }

    @Test
    void failsWhenReadingAttributeOfMissingData() {
        Map<String, Object> context = new HashMap<>();
        context.put("dataModel", null);

        assertThatThrownBy(() -> renderer.render("{{ dataModel.myData }}", context))
            .isInstanceOf(TemplateRenderingException.class)
            .hasMessage("Failed to render template");
    }

    @Test
    void failsOnMalformedTemplate() {
        assertThatThrownBy(() -> renderer.render("{% if %}", Map.of()))
            .isInstanceOf(TemplateRenderingException.class);
    }

    @Test
    void defaultEngineDoesNotRetainCompiledTemplates() {
        PebbleEngine engine = PebbleTemplateRenderer.defaultEngine(new ObjectMapper());
        String source = "<p>{{ name }}</p>";

        assertThat(engine.getLiteralTemplate(source)).isNotSameAs(engine.getLiteralTemplate(source));
    }

    @Test
    void rendersManyDistinctTemplatesWithSharedEngine() {
        for (int i = 0; i < 200; i++) {
            assertThat(renderer.render("<li>" + i + " {{ name }}</li>", Map.of("name", "n")))
                .isEqualTo("<li>" + i + " n</li>");
        }
    }
}
