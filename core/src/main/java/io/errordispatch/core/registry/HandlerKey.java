package io.errordispatch.core.registry;

import io.errordispatch.core.model.Tag;
import java.util.Objects;

/**
 * Identifier under which an {@link io.errordispatch.core.spi.ErrorHandler} is registered: an
 * error {@link Tag}, an error type, or the reserved {@link #DEFAULT}.
 */
public sealed interface HandlerKey permits HandlerKey.TagKey, HandlerKey.TypeKey, HandlerKey.Reserved {

    /** Reserved key of the fallback handler. */
    HandlerKey DEFAULT = Reserved.DEFAULT;

    static HandlerKey of(Tag tag) {
        return new TagKey(tag);
    }

    static HandlerKey of(Class<? extends Throwable> type) {
        return new TypeKey(type);
    }

    /** Matches errors whose tag equals {@code tag}. */
    record TagKey(Tag tag) implements HandlerKey {
        public TagKey {
            Objects.requireNonNull(tag, "tag must not be null");
        }

        @Override
        public String toString() {
            return tag.toString();
        }
    }

    /** Matches errors whose runtime class is {@code type}. */
    record TypeKey(Class<? extends Throwable> type) implements HandlerKey {
        public TypeKey {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String toString() {
            return type.getName();
        }
    }

    /** Reserved identifiers. */
    enum Reserved implements HandlerKey {
        DEFAULT
    }
}
