package com.cataphract.dto;

public record MovementValidation(boolean valid, String error) {

    public static MovementValidation ok() {
        return new MovementValidation(true, null);
    }

    public static MovementValidation invalid(String error) {
        return new MovementValidation(false, error);
    }
}
