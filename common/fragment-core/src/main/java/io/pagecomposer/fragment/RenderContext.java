package io.pagecomposer.fragment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request data visible to fetchers and to source locator interpolation. Owned by the caller and
 * never modified during a render.
 *
 * @param params     path parameters, used to fill {@code :name} placeholders
 * @param query      query parameters of the incoming request
 * @param headers    headers of the incoming request
 * @param attributes anything else the caller wants to hand to its fetcher or hooks
 */
public record RenderContext(
    Map<String, String> params,
    Map<String, List<String>> query,
    Map<String, String> headers,
    Map<String, Object> attributes
) {

    private static final RenderContext EMPTY = new RenderContext(null, null, null, null);

    public RenderContext {
        params = params == null ? Map.of() : Map.copyOf(params);
        query = query == null ? Map.of() : Map.copyOf(query);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static RenderContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, List<String>> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder param(String name, String value) {
            params.put(name, value);
            return this;
        }

        public Builder params(Map<String, String> values) {
            params.putAll(values);
            return this;
        }

        public Builder query(String name, List<String> values) {
            query.put(name, List.copyOf(values));
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder attribute(String name, Object value) {
            attributes.put(name, value);
            return this;
        }

        public RenderContext build() {
            return new RenderContext(params, query, headers, attributes);
        }
    }
}
