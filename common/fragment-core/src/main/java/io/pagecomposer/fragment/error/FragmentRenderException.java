package io.pagecomposer.fragment.error;

/**
 * Raised when expanding or evaluating a fragment template fails. Recoverable for optional fragments.
 */
public final class FragmentRenderException extends FragmentException {

    public FragmentRenderException(Throwable cause) {
        super(cause);
    }
}
