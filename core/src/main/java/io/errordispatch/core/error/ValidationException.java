package io.errordispatch.core.error;

import io.errordispatch.core.model.Direction;
import io.errordispatch.core.model.Tags;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural validation failure of a request or a response. The tag follows the {@link
 * Direction}: request failures answer 400, response failures 500.
 *
 * <p>The data map carries {@code in} (direction), {@code value} (the rejected value, nullable)
 * and {@code errors} (validation messages), plus any extra entries supplied by the validator.
 */
public class ValidationException extends TaggedException {

    private static final long serialVersionUID = 1L;

    private final Direction direction;
    private final List<String> errors;

    public ValidationException(Direction direction, Object value, List<String> errors) {
        this(direction, value, errors, Map.of());
    }

    public ValidationException(Direction direction, Object value, List<String> errors, Map<String, Object> extra) {
        super(
                Objects.requireNonNull(direction, "direction must not be null").name().toLowerCase() + " validation failed",
                direction == Direction.REQUEST ? Tags.REQUEST_VALIDATION : Tags.RESPONSE_VALIDATION,
                payload(direction, value, errors, extra));
        this.direction = direction;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public Direction direction() {
        return direction;
    }

    public List<String> errors() {
        return errors;
    }

    private static Map<String, Object> payload(
            Direction direction, Object value, List<String> errors, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>(extra != null ? extra : Map.of());
        data.put("in", direction.name().toLowerCase());
        data.put("value", value);
        data.put("errors", errors != null ? List.copyOf(errors) : List.of());
        return data;
    }
}
