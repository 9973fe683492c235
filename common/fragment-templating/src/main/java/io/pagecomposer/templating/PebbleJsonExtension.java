package io.pagecomposer.templating;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mitchellbosecke.pebble.extension.AbstractExtension;
import com.mitchellbosecke.pebble.extension.Filter;
import com.mitchellbosecke.pebble.template.EvaluationContext;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adds a {@code json} filter so templates can inline structured fragment data,
 * e.g. {@code {{ model.basket | json }}}.
 */
final class PebbleJsonExtension extends AbstractExtension {

    private final Filter jsonFilter;

    PebbleJsonExtension(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        this.jsonFilter = new JsonFilter(mapper);
    }

    @Override
    public Map<String, Filter> getFilters() {
        return Map.of("json", jsonFilter);
    }

    private static final class JsonFilter implements Filter {

        private final ObjectMapper mapper;

        private JsonFilter(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<String> getArgumentNames() {
            return List.of();
        }

        @Override
        public Object apply(Object input,
                            Map<String, Object> args,
                            PebbleTemplate self,
                            EvaluationContext context,
                            int lineNumber) {
            try {
                return mapper.writeValueAsString(input);
            } catch (JsonProcessingException ex) {
                throw new TemplateRenderingException("json filter could not serialise value at line " + lineNumber, ex);
            }
        }
    }
}
