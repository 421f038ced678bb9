package io.errordispatch.core.error;

import io.errordispatch.core.model.Tags;
import java.util.Map;
import java.util.Objects;

/** Thrown by request-body decoders when the body is not valid in its declared format. */
public class DecodeException extends TaggedException {

    private static final long serialVersionUID = 1L;

    /** Data key holding the format name, e.g. {@code "json"}. */
    public static final String FORMAT_KEY = "format";

    public DecodeException(String format, Throwable cause) {
        super(
                "Malformed " + format + " request",
                Tags.DECODE_FAILURE,
                Map.of(FORMAT_KEY, Objects.requireNonNull(format, "format must not be null")),
                cause);
    }

    /** The format the body failed to decode as. */
    public String format() {
        return (String) data().get(FORMAT_KEY);
    }
}
