package com.cataphract.model;

public enum NavalStatus {
    AVAILABLE,
    TRANSPORTING,
    FLED
}
