package com.cataphract.dto;

/**
 * Outcome of a resolved covert operation. The 2d6 roll had to reach {@code target}.
 */
public record OperationResult(boolean success, String detail, int roll, int target) {
}
