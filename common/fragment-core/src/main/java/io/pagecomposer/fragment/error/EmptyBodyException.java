package io.pagecomposer.fragment.error;

public final class EmptyBodyException extends FragmentException {

    public EmptyBodyException() {
        super("A fragment body is undefined");
    }
}
