package io.errordispatch.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Turns the structured payload of a validation error into a response body. The default
 * implementation is {@link io.errordispatch.core.handler.JacksonErrorEncoder}; frameworks with
 * their own error format plug in here.
 */
@FunctionalInterface
public interface ErrorEncoder {

    /**
     * @param errorData the error's data map
     * @return the JSON body to send
     */
    JsonNode encode(Map<String, Object> errorData);
}
