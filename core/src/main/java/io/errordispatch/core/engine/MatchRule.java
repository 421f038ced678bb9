package io.errordispatch.core.engine;

import io.errordispatch.core.error.ErrorValues;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.hierarchy.TypeHierarchy;
import io.errordispatch.core.model.Tag;
import io.errordispatch.core.registry.HandlerKey;
import io.errordispatch.core.registry.HandlerRegistry;
import java.util.Optional;

/**
 * Handler lookup rules, declared in precedence order. {@link ErrorDispatcher} evaluates them in
 * sequence and stops at the first one that yields a registered handler.
 */
public enum MatchRule {

    /** The error's tag is registered. */
    TAG {
        @Override
        Optional<Resolution> find(Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types) {
            Optional<Tag> tag = ErrorValues.tagOf(error);
            if (tag.isEmpty()) {
                return Optional.empty();
            }
            return registry.forTag(tag.get()).map(h -> new Resolution(h, this, HandlerKey.of(tag.get())));
        }
    },

    /** The error's runtime class is registered. */
    TYPE {
        @Override
        Optional<Resolution> find(Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types) {
            return registry.forType(error.getClass())
                    .map(h -> new Resolution(h, this, HandlerKey.of(error.getClass())));
        }
    },

    /** A tag the error's tag derives from is registered; the nearest ancestor wins. */
    TAG_ANCESTOR {
        @Override
        Optional<Resolution> find(Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types) {
            Optional<Tag> tag = ErrorValues.tagOf(error);
            if (tag.isEmpty()) {
                return Optional.empty();
            }
            for (Tag ancestor : tags.ancestors(tag.get())) {
                Optional<Resolution> match =
                        registry.forTag(ancestor).map(h -> new Resolution(h, this, HandlerKey.of(ancestor)));
                if (match.isPresent()) {
                    return match;
                }
            }
            return Optional.empty();
        }
    },

    /** A superclass of the error's class is registered; the nearest superclass wins. */
    SUPER_TYPE {
        @Override
        Optional<Resolution> find(Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types) {
            for (Class<?> superType : types.superTypes(error.getClass())) {
                Optional<Resolution> match = registry.forType(superType)
                        .map(h -> new Resolution(h, this, HandlerKey.of(superType.asSubclass(Throwable.class))));
                if (match.isPresent()) {
                    return match;
                }
            }
            return Optional.empty();
        }
    },

    /** The reserved default handler. */
    DEFAULT {
        @Override
        Optional<Resolution> find(Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types) {
            return registry.defaultHandler().map(h -> new Resolution(h, this, HandlerKey.DEFAULT));
        }
    };

    abstract Optional<Resolution> find(
            Throwable error, HandlerRegistry registry, TagHierarchy tags, TypeHierarchy types);
}
