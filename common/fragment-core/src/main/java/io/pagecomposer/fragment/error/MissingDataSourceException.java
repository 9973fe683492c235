package io.pagecomposer.fragment.error;

/**
 * A dependency listed in {@code models} (or a fragment's required data) is not a fragment of the route.
 */
public final class MissingDataSourceException extends FragmentException {

    private final String sourceName;

    public MissingDataSourceException(String sourceName) {
        super("Attempting to render with a data source fragment which doesnt exist in configuration (name "
            + sourceName + ")");
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
