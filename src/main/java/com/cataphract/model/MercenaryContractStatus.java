package com.cataphract.model;

public enum MercenaryContractStatus {
    ACTIVE,
    UNPAID,
    EXPIRED,
    TERMINATED;

    /** Contracts still charged upkeep. */
    public boolean isPayable() {
        return this == ACTIVE || this == UNPAID;
    }
}
