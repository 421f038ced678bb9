package io.errordispatch.core.model;

/** Which side of an exchange a validation failure refers to. */
public enum Direction {
    REQUEST,
    RESPONSE
}
