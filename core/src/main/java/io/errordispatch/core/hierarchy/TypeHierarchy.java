package io.errordispatch.core.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Superclass chains of error types, read by reflection. Chains are memoised per class; the
 * class graph never changes at runtime, so the cache needs no invalidation.
 */
public final class TypeHierarchy {

    private final Map<Class<?>, List<Class<?>>> chains = new ConcurrentHashMap<>();

    /**
     * Returns the strict superclasses of {@code type}, nearest first, stopping before {@link
     * Object}. For {@code IllegalArgumentException} this is {@code [RuntimeException, Exception,
     * Throwable]}.
     *
     * @param type the runtime type of an error
     * @return an unmodifiable list, empty for {@code Object} and interfaces
     */
    public List<Class<?>> superTypes(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        return chains.computeIfAbsent(type, TypeHierarchy::chainOf);
    }

    private static List<Class<?>> chainOf(Class<?> type) {
        List<Class<?>> chain = new ArrayList<>();
        Class<?> current = type.getSuperclass();
        while (current != null && current != Object.class) {
            chain.add(current);
            current = current.getSuperclass();
        }
        return List.copyOf(chain);
    }
}
