package com.cataphract.rng;

public record IntResult(int value, int min, int max, String seed) {
}
