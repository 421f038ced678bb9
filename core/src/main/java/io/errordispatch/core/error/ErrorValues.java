package io.errordispatch.core.error;

import io.errordispatch.core.model.Tag;
import java.util.Map;
import java.util.Optional;

/** Reads the structured payload of an arbitrary error value. */
public final class ErrorValues {

    private ErrorValues() {
        // utility class
    }

    /** The error's tag, or empty for errors without a structured payload. */
    public static Optional<Tag> tagOf(Throwable error) {
        if (error instanceof TaggedException tagged) {
            return Optional.of(tagged.tag());
        }
        return Optional.empty();
    }

    /** The error's data map; empty for errors without a structured payload. */
    public static Map<String, Object> dataOf(Throwable error) {
        if (error instanceof TaggedException tagged) {
            return tagged.data();
        }
        return Map.of();
    }
}
