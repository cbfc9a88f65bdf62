package com.cataphract.dto;

/**
 * A 2d6 morale check: it succeeds when the roll does not exceed current morale.
 */
public record MoraleCheck(boolean success, int roll, int morale) {
}
