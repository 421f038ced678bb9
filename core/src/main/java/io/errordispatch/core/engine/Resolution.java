package io.errordispatch.core.engine;

import io.errordispatch.core.registry.HandlerKey;
import io.errordispatch.core.spi.ErrorHandler;

/**
 * The handler chosen for an error, with the rule and registry key that selected it.
 *
 * @param handler the resolved handler
 * @param rule the rule that matched
 * @param key the registry key the handler is stored under
 */
public record Resolution(ErrorHandler handler, MatchRule rule, HandlerKey key) {}
