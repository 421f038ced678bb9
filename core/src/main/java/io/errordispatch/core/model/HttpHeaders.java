package io.errordispatch.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive HTTP header collection shared by {@link Request} and {@link
 * Response}. Names are stored lowercase; {@link #with(String, String)} returns a copy.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /** First value for a header name, or {@code null} if absent. */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** All values for a header name, or an empty list if absent. */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? values : List.of();
    }

    public boolean contains(String name) {
        return store.containsKey(name);
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /**
     * Returns a copy with {@code name} set to the single value {@code value}, replacing any
     * existing values.
     */
    public HttpHeaders with(String name, String value) {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(store);
        copy.remove(name);
        copy.put(name.toLowerCase(), List.of(value));
        return new HttpHeaders(copy);
    }

    /** First-value-per-name view with lowercase keys. */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new TreeMap<>();
        store.forEach((key, values) -> {
            if (!values.isEmpty()) {
                result.put(key, values.get(0));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /** All-values-per-name view with lowercase keys. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(new TreeMap<>(store));
    }

    // ── Factory methods ──

    /** Creates headers from a single-value map. */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> map.put(key.toLowerCase(), List.of(value)));
        return new HttpHeaders(map);
    }

    /** Creates headers from a multi-value map. */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> map.put(key.toLowerCase(), List.copyOf(values)));
        return new HttpHeaders(map);
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
