package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Side of a signal or recommendation. Serialized as {@code "long"} / {@code "short"}
 * to match the upstream intake payloads.
 */
public enum Direction {

    LONG("long"),
    SHORT("short");

    private final String value;

    Direction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** +1 for LONG, −1 for SHORT. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    @JsonCreator
    public static Direction fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
        for (Direction d : values()) {
            if (d.value.equalsIgnoreCase(raw) || d.name().equalsIgnoreCase(raw)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + raw);
    }
}
