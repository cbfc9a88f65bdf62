package com.cataphract.rng;

/**
 * Outcome of a probability check: success means {@code roll >= target}.
 */
public record SuccessCheck(boolean success, int roll, int target, double probability, String seed) {
}
