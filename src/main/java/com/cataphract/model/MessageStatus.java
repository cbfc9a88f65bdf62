package com.cataphract.model;

public enum MessageStatus {
    IN_TRANSIT,
    DELIVERED,
    FAILED
}
