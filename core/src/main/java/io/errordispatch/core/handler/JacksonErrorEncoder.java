package io.errordispatch.core.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.errordispatch.core.spi.ErrorEncoder;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link ErrorEncoder}: converts every data entry to JSON with Jackson, except the
 * request and response objects, which are neither safe nor useful to echo back to a client.
 * Values Jackson cannot serialize are written as their {@code toString()}.
 */
public final class JacksonErrorEncoder implements ErrorEncoder {

    private static final Set<String> EXCLUDED_KEYS = Set.of("request", "response");

    private final ObjectMapper mapper;

    public JacksonErrorEncoder() {
        this(new ObjectMapper());
    }

    public JacksonErrorEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public JsonNode encode(Map<String, Object> errorData) {
        ObjectNode node = mapper.createObjectNode();
        errorData.forEach((key, value) -> {
            if (EXCLUDED_KEYS.contains(key)) {
                return;
            }
            node.set(key, toJson(value));
        });
        return node;
    }

    private JsonNode toJson(Object value) {
        if (value == null) {
            return mapper.nullNode();
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            // not a bean Jackson understands
            return mapper.getNodeFactory().textNode(value.toString());
        }
    }
}
