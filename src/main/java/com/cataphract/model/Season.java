package com.cataphract.model;

public enum Season {
    SPRING,
    SUMMER,
    FALL,
    WINTER
}
