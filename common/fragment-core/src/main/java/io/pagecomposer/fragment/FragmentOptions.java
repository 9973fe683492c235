package io.pagecomposer.fragment;

import io.pagecomposer.fragment.source.SourceLocator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * Immutable configuration a {@link FragmentFactory} instantiates fragments from.
 *
 * @param source                where the body comes from, {@code null} for inline data
 * @param method                HTTP method used for remote sources, {@code GET} when not set
 * @param query                 static query parameters added to remote requests
 * @param headers               static headers added to remote requests
 * @param passQueryParams       forward the incoming request's query parameters to remote sources
 * @param inlineData            literal body used when there is no source
 * @param inlineDataPresent     whether {@code inlineData} was configured at all ({@code null} is a valid value)
 * @param bodyType              body shape, set by the factory
 * @param requiredData          names of sibling fragments needed as rendering context
 * @param required              failures of this fragment abort the whole render
 * @param bodyParser            post-processing applied by fetchers to the loaded body
 * @param onFetchError          notified by fetchers whenever loading the body fails
 * @param contentMissingMessage substituted when the body could not be fetched
 * @param renderErrorMessage    substituted when the fragment could not be rendered
 */
public record FragmentOptions(
    SourceLocator source,
    String method,
    Map<String, String> query,
    Map<String, String> headers,
    boolean passQueryParams,
    Object inlineData,
    boolean inlineDataPresent,
    BodyType bodyType,
    List<String> requiredData,
    boolean required,
    BiFunction<Object, RenderContext, Object> bodyParser,
    BiConsumer<Throwable, RenderContext> onFetchError,
    FallbackMessage contentMissingMessage,
    FallbackMessage renderErrorMessage
) {

    public FragmentOptions {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        query = query == null ? Map.of() : Map.copyOf(query);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        requiredData = requiredData == null ? List.of() : List.copyOf(new LinkedHashSet<>(requiredData));
    }

    public static Builder builder() {
        return new Builder();
    }

    FragmentOptions withBodyType(BodyType type) {
        return new FragmentOptions(source, method, query, headers, passQueryParams, inlineData, inlineDataPresent,
            type, requiredData, required, bodyParser, onFetchError, contentMissingMessage, renderErrorMessage);
    }

    FragmentOptions withRequired(boolean value) {
        return new FragmentOptions(source, method, query, headers, passQueryParams, inlineData, inlineDataPresent,
            bodyType, requiredData, value, bodyParser, onFetchError, contentMissingMessage, renderErrorMessage);
    }

    public static final class Builder {
        private SourceLocator source;
        private String method;
        private Map<String, String> query = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private boolean passQueryParams;
        private Object inlineData;
        private boolean inlineDataPresent;
        private BodyType bodyType;
        private List<String> requiredData = List.of();
        private boolean required;
        private BiFunction<Object, RenderContext, Object> bodyParser;
        private BiConsumer<Throwable, RenderContext> onFetchError;
        private FallbackMessage contentMissingMessage;
        private FallbackMessage renderErrorMessage;

        public Builder source(SourceLocator source) {
            this.source = source;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder query(Map<String, String> query) {
            this.query = new LinkedHashMap<>(query);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = new LinkedHashMap<>(headers);
            return this;
        }

        public Builder passQueryParams(boolean passQueryParams) {
            this.passQueryParams = passQueryParams;
            return this;
        }

        public Builder data(Object inlineData) {
            this.inlineData = inlineData;
            this.inlineDataPresent = true;
            return this;
        }

        public Builder bodyType(BodyType bodyType) {
            this.bodyType = bodyType;
            return this;
        }

        public Builder requiredData(List<String> requiredData) {
            this.requiredData = requiredData;
            return this;
        }

        public Builder requiredData(String... requiredData) {
            return requiredData(List.of(requiredData));
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder bodyParser(BiFunction<Object, RenderContext, Object> bodyParser) {
            this.bodyParser = bodyParser;
            return this;
        }

        public Builder onFetchError(BiConsumer<Throwable, RenderContext> onFetchError) {
            this.onFetchError = onFetchError;
            return this;
        }

        public Builder contentMissingMessage(FallbackMessage contentMissingMessage) {
            this.contentMissingMessage = contentMissingMessage;
            return this;
        }

        public Builder contentMissingMessage(String message) {
            return contentMissingMessage(FallbackMessage.literal(message));
        }

        public Builder renderErrorMessage(FallbackMessage renderErrorMessage) {
            this.renderErrorMessage = renderErrorMessage;
            return this;
        }

        public Builder renderErrorMessage(String message) {
            return renderErrorMessage(FallbackMessage.literal(message));
        }

        public FragmentOptions build() {
            return new FragmentOptions(source, method, query, headers, passQueryParams, inlineData, inlineDataPresent,
                bodyType, requiredData, required, bodyParser, onFetchError, contentMissingMessage, renderErrorMessage);
        }
    }
}
