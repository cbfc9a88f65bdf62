package com.cataphract.dto;

public record NavalActionResult(boolean success, String detail) {

    public static NavalActionResult ok(String detail) {
        return new NavalActionResult(true, detail);
    }

    public static NavalActionResult failed(String detail) {
        return new NavalActionResult(false, detail);
    }
}
