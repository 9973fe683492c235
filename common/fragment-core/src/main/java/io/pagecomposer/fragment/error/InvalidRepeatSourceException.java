package io.pagecomposer.fragment.error;

/**
 * The root of a {@code fragment-repeat} path is not a declared dependency of the injection,
 * or is not a fragment of the route.
 */
public final class InvalidRepeatSourceException extends FragmentException {

    private final String repeatPath;

    public InvalidRepeatSourceException(String repeatPath) {
        super("Attempting to render a list of data with source which doesnt exist or isnt "
            + "specified as a dependency with accessor '" + repeatPath + "'");
        this.repeatPath = repeatPath;
    }

    public String repeatPath() {
        return repeatPath;
    }
}
