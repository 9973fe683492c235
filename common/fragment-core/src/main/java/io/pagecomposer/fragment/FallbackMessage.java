package io.pagecomposer.fragment;

import java.util.Objects;
import java.util.function.Function;

/**
 * A message substituted for a fragment that could not be fetched or rendered: either a fixed value
 * or a function of the triggering error. Values that are not strings are treated as structured content.
 */
@FunctionalInterface
public interface FallbackMessage {

    Object resolve(Throwable error);

    static FallbackMessage literal(Object message) {
        return error -> message;
    }

    static FallbackMessage of(Function<Throwable, Object> callback) {
        Objects.requireNonNull(callback, "callback");
        return callback::apply;
    }
}
