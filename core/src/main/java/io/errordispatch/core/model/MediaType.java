package io.errordispatch.core.model;

import java.util.Locale;

/**
 * Media types produced by error responses. Keeps raw {@code Content-Type} strings and Jackson
 * types out of the public model.
 */
public enum MediaType {
    /** {@code application/json}. */
    JSON("application/json"),

    /** {@code application/problem+json} (RFC 9457). */
    PROBLEM_JSON("application/problem+json"),

    /** {@code text/plain}. */
    TEXT("text/plain"),

    /** {@code application/octet-stream}, also the fallback for unrecognized types. */
    BINARY("application/octet-stream"),

    /** No content type. */
    NONE(null);

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    /** Returns the MIME type string, or {@code null} for {@link #NONE}. */
    public String value() {
        return value;
    }

    /**
     * Resolves a {@code Content-Type} header value, ignoring parameters such as {@code charset}.
     * Returns {@link #NONE} for blank input and {@link #BINARY} for unknown types; other {@code
     * +json} structured suffixes resolve to {@link #JSON}.
     */
    public static MediaType fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return NONE;
        }
        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        mime = mime.strip().toLowerCase(Locale.ROOT);

        for (MediaType type : values()) {
            if (type.value != null && type.value.equals(mime)) {
                return type;
            }
        }
        if (mime.endsWith("+json")) {
            return JSON;
        }
        return BINARY;
    }
}
