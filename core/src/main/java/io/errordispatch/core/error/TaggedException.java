package io.errordispatch.core.error;

import io.errordispatch.core.model.Tag;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Application error with a structured payload: a {@link Tag} that drives handler lookup and a
 * map of data the handler may read. Throw it directly for ad-hoc tags, or use one of the
 * subclasses the default handlers understand.
 */
public class TaggedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Tag tag;
    private final transient Map<String, Object> data;

    public TaggedException(String message, Tag tag) {
        this(message, tag, Map.of(), null);
    }

    public TaggedException(String message, Tag tag, Map<String, Object> data) {
        this(message, tag, data, null);
    }

    public TaggedException(String message, Tag tag, Map<String, Object> data, Throwable cause) {
        super(message, cause);
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /** The tag identifying this error's kind. */
    public Tag tag() {
        return tag;
    }

    /** Structured payload; unmodifiable, never null. */
    public Map<String, Object> data() {
        return data;
    }
}
