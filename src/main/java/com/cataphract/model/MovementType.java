package com.cataphract.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Marching mode requested by a move order.
 */
public enum MovementType {
    STANDARD("standard"),
    FORCED("forced"),
    NIGHT("night");

    private final String code;

    MovementType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<MovementType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
