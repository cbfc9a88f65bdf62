package com.cataphract.rng;

public record ChoiceResult<T>(T choice, int index, String seed) {
}
