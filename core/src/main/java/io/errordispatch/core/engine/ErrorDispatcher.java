package io.errordispatch.core.engine;

import io.errordispatch.core.error.ConfigurationException;
import io.errordispatch.core.error.ErrorDispatchException;
import io.errordispatch.core.error.ErrorValues;
import io.errordispatch.core.hierarchy.TagHierarchy;
import io.errordispatch.core.hierarchy.TypeHierarchy;
import io.errordispatch.core.model.DispatchResult;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Tag;
import io.errordispatch.core.registry.HandlerRegistry;
import io.errordispatch.core.spi.WrapFunction;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Resolves the handler for an error and invokes it.
 *
 * <p>Lookup order, first registered entry wins:
 *
 * <ol>
 * <li>the error's tag;
 * <li>the error's runtime class;
 * <li>the tags the error's tag derives from, nearest first;
 * <li>the superclasses of the error's class, nearest first;
 * <li>the default handler.
 * </ol>
 *
 * <p>If the registry has a wrap function the resolved handler is passed to it; otherwise it is
 * invoked directly. A handler that returns or throws an application error yields {@link
 * DispatchResult#error(Throwable)}; the dispatcher never dispatches that error itself, that is
 * the host pipeline's decision. Only {@link ErrorDispatchException}s escape.
 *
 * <p>Thread-safe and stateless beyond its immutable registry and the shared hierarchies.
 */
public final class ErrorDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorDispatcher.class);

    /** Precedence order of the lookup rules. */
    static final List<MatchRule> RULES = List.of(
            MatchRule.TAG, MatchRule.TYPE, MatchRule.TAG_ANCESTOR, MatchRule.SUPER_TYPE, MatchRule.DEFAULT);

    static final String MDC_TAG = "error.tag";
    static final String MDC_RULE = "error.rule";

    private final HandlerRegistry registry;
    private final TagHierarchy tagHierarchy;
    private final TypeHierarchy typeHierarchy;

    public ErrorDispatcher(HandlerRegistry registry, TagHierarchy tagHierarchy) {
        this(registry, tagHierarchy, new TypeHierarchy());
    }

    public ErrorDispatcher(HandlerRegistry registry, TagHierarchy tagHierarchy, TypeHierarchy typeHierarchy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tagHierarchy = Objects.requireNonNull(tagHierarchy, "tagHierarchy must not be null");
        this.typeHierarchy = Objects.requireNonNull(typeHierarchy, "typeHierarchy must not be null");
    }

    /**
     * Selects the handler for {@code error} without invoking it.
     *
     * @throws ConfigurationException if nothing matches and no default handler is registered
     */
    public Resolution resolve(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        for (MatchRule rule : RULES) {
            Optional<Resolution> match = rule.find(error, registry, tagHierarchy, typeHierarchy);
            if (match.isPresent()) {
                return match.get();
            }
        }
        throw new ConfigurationException(
                "No handler for " + error.getClass().getName() + " and no default handler registered",
                ErrorDispatchException.Phase.DISPATCH);
    }

    /**
     * Resolves and invokes the handler for {@code error}.
     *
     * @param error the error raised while processing {@code request}
     * @param request the failed request
     * @return the handler's response, or a replacement error for the host to re-dispatch
     */
    public DispatchResult dispatch(Throwable error, Request request) {
        Objects.requireNonNull(request, "request must not be null");
        Resolution resolution = resolve(error);
        String tag = ErrorValues.tagOf(error).map(Tag::toString).orElse(null);

        LOG.debug(
                "Dispatching {} (tag={}) for {} {}: rule={}, key={}",
                error.getClass().getName(),
                tag,
                request.method(),
                request.path(),
                resolution.rule(),
                resolution.key());

        MDC.put(MDC_RULE, resolution.rule().name());
        if (tag != null) {
            MDC.put(MDC_TAG, tag);
        }
        try {
            DispatchResult result = invoke(resolution, error, request);
            if (result == null) {
                return DispatchResult.error(
                        new IllegalStateException("Error handler for " + resolution.key() + " returned no result"));
            }
            if (result.isError()) {
                LOG.debug(
                        "Handler for {} produced {} for re-dispatch",
                        resolution.key(),
                        result.error().getClass().getName());
            }
            return result;
        } catch (ErrorDispatchException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.debug("Handler for {} threw {}: {}", resolution.key(), e.getClass().getName(), e.getMessage());
            return DispatchResult.error(e);
        } finally {
            MDC.remove(MDC_RULE);
            MDC.remove(MDC_TAG);
        }
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public TagHierarchy tagHierarchy() {
        return tagHierarchy;
    }

    private DispatchResult invoke(Resolution resolution, Throwable error, Request request) {
        Optional<WrapFunction> wrap = registry.wrap();
        if (wrap.isPresent()) {
            return wrap.get().wrap(resolution.handler(), error, request);
        }
        return resolution.handler().handle(error, request);
    }
}
