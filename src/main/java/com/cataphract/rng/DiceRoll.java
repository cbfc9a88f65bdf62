package com.cataphract.rng;

import java.util.List;

/**
 * Individual die values of one roll and their sum.
 */
public record DiceRoll(String notation, List<Integer> rolls, int total, String seed) {

    public DiceRoll {
        rolls = List.copyOf(rolls);
    }
}
