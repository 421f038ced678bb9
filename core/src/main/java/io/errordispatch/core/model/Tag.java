package io.errordispatch.core.model;

import java.util.Objects;

/**
 * Symbolic error identifier carried in the structured payload of a {@link
 * io.errordispatch.core.error.TaggedException}. Tags take part in a derivation hierarchy
 * ({@link io.errordispatch.core.hierarchy.TagHierarchy}) and are the primary handler lookup key.
 *
 * <p>A tag has an optional namespace and a mandatory name. The textual form is {@code
 * namespace/name}, or just {@code name} when no namespace is set.
 *
 * @param namespace the namespace, or {@code null}
 * @param name the local name, never blank
 */
public record Tag(String namespace, String name) {

    public Tag {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("tag name must not be blank");
        }
        if (namespace != null && namespace.isBlank()) {
            namespace = null;
        }
    }

    /** Creates a namespaced tag. */
    public static Tag of(String namespace, String name) {
        return new Tag(namespace, name);
    }

    /**
     * Parses the textual form. The last {@code /} separates namespace and name, so {@code
     * "app.orders/not-found"} yields namespace {@code app.orders} and name {@code not-found}.
     *
     * @param text tag text, e.g. {@code "app/error"} or {@code "error"}
     * @return the parsed tag
     * @throws IllegalArgumentException if the text is blank or ends with {@code /}
     */
    public static Tag parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.strip();
        if (trimmed.startsWith(":")) {
            trimmed = trimmed.substring(1);
        }
        int slash = trimmed.lastIndexOf('/');
        if (slash < 0) {
            return new Tag(null, trimmed);
        }
        if (slash == trimmed.length() - 1) {
            throw new IllegalArgumentException("Invalid tag '" + text + "': missing name after '/'");
        }
        return new Tag(trimmed.substring(0, slash), trimmed.substring(slash + 1));
    }

    @Override
    public String toString() {
        return namespace != null ? namespace + "/" + name : name;
    }
}
