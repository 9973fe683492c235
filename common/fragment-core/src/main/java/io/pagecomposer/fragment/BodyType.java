package io.pagecomposer.fragment;

/**
 * Shape of a fragment's body once fetched.
 */
public enum BodyType {
    /**
     * Markup used as a template or injected as text.
     */
    HTML("text/html"),

    /**
     * Structured data, parsed into maps and lists, typically consumed through {@code models}.
     */
    JSON("application/json");

    private final String defaultContentType;

    BodyType(String defaultContentType) {
        this.defaultContentType = defaultContentType;
    }

    public String defaultContentType() {
        return defaultContentType;
    }
}
