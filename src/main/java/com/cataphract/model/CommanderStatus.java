package com.cataphract.model;

public enum CommanderStatus {
    ACTIVE,
    ESCAPED,
    CAPTURED
}
