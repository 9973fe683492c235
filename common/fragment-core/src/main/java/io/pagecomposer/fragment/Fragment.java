package io.pagecomposer.fragment;

import io.pagecomposer.fragment.source.LocalFilePath;
import io.pagecomposer.fragment.source.RemoteUrl;
import io.pagecomposer.fragment.source.SourceLocator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * Defines the existence and handling of one piece of content: data from a {@link RemoteUrl} or a
 * {@link LocalFilePath}, or a static body held inline. Instances are created per render by a
 * {@link FragmentFactory} and never change afterwards.
 */
public final class Fragment {

    static final String DEFAULT_CONTENT_MISSING_MESSAGE =
        "<p>Sorry this content could not be fetched. Please try again.</p>";
    static final String DEFAULT_RENDER_ERROR_MESSAGE =
        "<p>Sorry this content could not be rendered. Please try again.</p>";

    private final FragmentType type;
    private final FragmentOptions options;

    Fragment(FragmentType type, FragmentOptions options) {
        this.type = Objects.requireNonNull(type, "type");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Builds an anonymous markup fragment around a template embedded in an injection tag.
     */
    public static Fragment inline(String template, boolean required) {
        return FragmentFactory.html(FragmentOptions.builder()
            .data(template)
            .required(required)
            .build()).create();
    }

    public FragmentType type() {
        return type;
    }

    public SourceLocator source() {
        return options.source();
    }

    public String method() {
        return options.method();
    }

    public Map<String, String> query() {
        return options.query();
    }

    public Map<String, String> headers() {
        return options.headers();
    }

    public boolean passQueryParams() {
        return options.passQueryParams();
    }

    public BodyType bodyType() {
        return options.bodyType() == null ? BodyType.HTML : options.bodyType();
    }

    public boolean isJson() {
        return bodyType() == BodyType.JSON;
    }

    public boolean isFile() {
        return options.source() instanceof LocalFilePath;
    }

    public boolean isRemote() {
        return options.source() instanceof RemoteUrl;
    }

    /**
     * @return {@code true} when the fragment has no source and its body is {@link #localData()}
     */
    public boolean isLocalData() {
        return options.source() == null;
    }

    /**
     * @return whether inline data was configured, which may be {@code null} itself
     */
    public boolean hasLocalData() {
        return options.inlineDataPresent();
    }

    public Object localData() {
        return options.inlineData();
    }

    public List<String> requiredData() {
        return options.requiredData();
    }

    public boolean isRequired() {
        return options.required();
    }

    /**
     * @return hook applied by fetchers to the loaded body, or {@code null}
     */
    public BiFunction<Object, RenderContext, Object> bodyParser() {
        return options.bodyParser();
    }

    /**
     * @return hook fetchers notify when loading the body fails, or {@code null}
     */
    public BiConsumer<Throwable, RenderContext> onFetchError() {
        return options.onFetchError();
    }

    /**
     * Body substituted when fetching failed. Non-string messages are flagged as JSON.
     */
    public FragmentBody contentMissingMessage(Throwable fetchError) {
        Object message = resolve(options.contentMissingMessage(), fetchError);
        if (message == null) {
            return new FragmentBody(DEFAULT_CONTENT_MISSING_MESSAGE, BodyType.HTML.defaultContentType());
        }
        String contentType = message instanceof String
            ? BodyType.HTML.defaultContentType()
            : BodyType.JSON.defaultContentType();
        return new FragmentBody(message, contentType);
    }

    /**
     * Text substituted when rendering an optional fragment failed.
     */
    public String renderErrorMessage(Throwable renderError) {
        Object message = resolve(options.renderErrorMessage(), renderError);
        return message == null ? DEFAULT_RENDER_ERROR_MESSAGE : message.toString();
    }

    private static Object resolve(FallbackMessage message, Throwable error) {
        return message == null ? null : message.resolve(error);
    }

    @Override
    public String toString() {
        String kind = isFile() ? "Url.LocalFilePath" : bodyType().name() + (isRemote() ? " Url.Remote" : " Inline");
        String q = options.query().isEmpty() ? "-" : options.query().toString();
        String h = options.headers().isEmpty() ? "-" : options.headers().toString();
        return kind + " Fragment(url: " + options.source() + ", query params: " + q + ", headers: " + h + ")";
    }
}
