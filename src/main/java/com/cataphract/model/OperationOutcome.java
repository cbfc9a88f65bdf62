package com.cataphract.model;

public enum OperationOutcome {
    PENDING,
    SUCCESS,
    FAILURE,
    INTERRUPTED
}
