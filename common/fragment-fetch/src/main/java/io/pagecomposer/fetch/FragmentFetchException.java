package io.pagecomposer.fetch;

import io.pagecomposer.fragment.error.FragmentException;

/**
 * A fragment body could not be loaded. Carries the HTTP status for remote sources that answered
 * with a non-success code, {@code -1} otherwise.
 */
public final class FragmentFetchException extends FragmentException {

    private final int status;

    public FragmentFetchException(String message) {
        this(message, -1);
    }

    public FragmentFetchException(String message, int status) {
        super(message);
        this.status = status;
    }

    public FragmentFetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int status() {
        return status;
    }
}
