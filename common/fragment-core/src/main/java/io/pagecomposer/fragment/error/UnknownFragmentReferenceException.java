package io.pagecomposer.fragment.error;

/**
 * An injection tag, or a lookup by name, refers to a fragment the route does not declare.
 * Always fatal to the render.
 */
public final class UnknownFragmentReferenceException extends FragmentException {

    private final String fragmentName;

    public UnknownFragmentReferenceException(String fragmentName) {
        super("A source fragment does not exist with name " + fragmentName);
        this.fragmentName = fragmentName;
    }

    public String fragmentName() {
        return fragmentName;
    }
}
