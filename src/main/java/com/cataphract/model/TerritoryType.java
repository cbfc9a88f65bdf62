package com.cataphract.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Allegiance of the ground a messenger or agent must cross.
 */
public enum TerritoryType {
    FRIENDLY("friendly"),
    NEUTRAL("neutral"),
    HOSTILE("hostile");

    private final String code;

    TerritoryType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<TerritoryType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
