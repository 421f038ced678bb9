package io.errordispatch.core.registry;

import io.errordispatch.core.error.ConfigurationException;
import io.errordispatch.core.model.Tag;
import io.errordispatch.core.spi.ErrorHandler;
import io.errordispatch.core.spi.WrapFunction;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from {@link HandlerKey} to {@link ErrorHandler}, plus the optional {@link
 * WrapFunction}. Built once per pipeline configuration, usually by merging overrides into
 * {@link io.errordispatch.core.handler.DefaultHandlers#registry()}.
 *
 * <p>Every registry has a {@link HandlerKey#DEFAULT} handler: {@link Builder#build()} refuses
 * to produce one without it.
 *
 * <p>Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class HandlerRegistry {

    private final Map<HandlerKey, ErrorHandler> handlers;
    private final WrapFunction wrap;

    private HandlerRegistry(Map<HandlerKey, ErrorHandler> handlers, WrapFunction wrap) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        this.wrap = wrap;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this registry's entries, for adding overrides. */
    public Builder toBuilder() {
        return new Builder().merge(this);
    }

    /** Handler registered for exactly this tag. */
    public Optional<ErrorHandler> forTag(Tag tag) {
        return Optional.ofNullable(handlers.get(HandlerKey.of(tag)));
    }

    /** Handler registered for exactly this error type. */
    public Optional<ErrorHandler> forType(Class<?> type) {
        if (!Throwable.class.isAssignableFrom(type)) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(HandlerKey.of(type.asSubclass(Throwable.class))));
    }

    /** The fallback handler, or empty if this registry was assembled without one. */
    public Optional<ErrorHandler> defaultHandler() {
        return Optional.ofNullable(handlers.get(HandlerKey.DEFAULT));
    }

    public Optional<WrapFunction> wrap() {
        return Optional.ofNullable(wrap);
    }

    /** Registered keys in registration order, {@link HandlerKey#DEFAULT} included. */
    public Set<HandlerKey> keys() {
        return handlers.keySet();
    }

    /** Unmodifiable view of all handler entries. */
    public Map<HandlerKey, ErrorHandler> handlers() {
        return handlers;
    }

    public int size() {
        return handlers.size();
    }

    @Override
    public String toString() {
        return "HandlerRegistry" + handlers.keySet() + (wrap != null ? "+wrap" : "");
    }

    /**
     * Builder for {@link HandlerRegistry}. Registering a key a second time replaces the earlier
     * handler, which is how overrides are merged over a base set.
     */
    public static final class Builder {

        private final Map<HandlerKey, ErrorHandler> handlers = new LinkedHashMap<>();
        private WrapFunction wrap;

        Builder() {}

        /** Registers a handler for errors tagged {@code tag}. */
        public Builder on(Tag tag, ErrorHandler handler) {
            return put(HandlerKey.of(tag), handler);
        }

        /** Registers a handler for errors of type {@code type} (and, by fallback, subtypes). */
        public Builder on(Class<? extends Throwable> type, ErrorHandler handler) {
            return put(HandlerKey.of(type), handler);
        }

        public Builder defaultHandler(ErrorHandler handler) {
            return put(HandlerKey.DEFAULT, handler);
        }

        public Builder put(HandlerKey key, ErrorHandler handler) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(handler, "handler must not be null for key " + key);
            handlers.put(key, handler);
            return this;
        }

        public Builder putAll(Map<HandlerKey, ErrorHandler> entries) {
            entries.forEach(this::put);
            return this;
        }

        /** Sets the wrap function; {@code null} removes it. */
        public Builder wrap(WrapFunction wrapFunction) {
            this.wrap = wrapFunction;
            return this;
        }

        /**
         * Copies every entry of {@code other} into this builder, replacing existing keys. The
         * other registry's wrap function replaces this builder's only when it has one.
         */
        public Builder merge(HandlerRegistry other) {
            putAll(other.handlers);
            other.wrap().ifPresent(w -> this.wrap = w);
            return this;
        }

        /**
         * @return the registry
         * @throws ConfigurationException if no {@link HandlerKey#DEFAULT} handler is registered
         */
        public HandlerRegistry build() {
            if (!handlers.containsKey(HandlerKey.DEFAULT)) {
                throw new ConfigurationException(
                        "No default handler registered; errors matching no other entry would be unhandled. Registered keys: "
                                + handlers.keySet());
            }
            return new HandlerRegistry(handlers, wrap);
        }
    }
}
