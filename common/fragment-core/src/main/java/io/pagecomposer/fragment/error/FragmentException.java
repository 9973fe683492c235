package io.pagecomposer.fragment.error;

/**
 * Root of the composition error hierarchy. Every subtype keeps the error it was raised from,
 * if any, reachable through {@link #original()}.
 */
public class FragmentException extends RuntimeException {

    public FragmentException(String message) {
        super(message);
    }

    public FragmentException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps {@code cause}, reusing its message so the wrapper reads like the source failure.
     */
    public FragmentException(Throwable cause) {
        super(cause == null || cause.getMessage() == null ? "" : cause.getMessage(), cause);
    }

    /**
     * @return the error this instance was created from, or {@code null}
     */
    public Throwable original() {
        return getCause();
    }
}
