package io.pagecomposer.fragment;

/**
 * The body of a fragment once it has been loaded, together with its content type.
 *
 * @param body        text for markup fragments, parsed maps/lists for JSON fragments, may be {@code null}
 * @param contentType MIME type, {@code text/html} when not supplied
 */
public record FragmentBody(Object body, String contentType) {

    public static final String DEFAULT_CONTENT_TYPE = "text/html";

    public FragmentBody {
        contentType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
    }

    public FragmentBody(Object body) {
        this(body, DEFAULT_CONTENT_TYPE);
    }
}
