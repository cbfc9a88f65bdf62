package com.cataphract.model;

public enum SiegeStatus {
    ONGOING,
    GATES_OPENED,
    SUCCESSFUL_ASSAULT,
    LIFTED
}
