package com.cataphract.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Categories of covert operation a commander may launch.
 */
public enum OperationType {
    INTELLIGENCE("intelligence"),
    ASSASSINATION("assassination"),
    SABOTAGE("sabotage");

    private final String code;

    OperationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<OperationType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
