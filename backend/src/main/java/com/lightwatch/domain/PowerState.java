package com.lightwatch.domain;

public enum PowerState {
    UNKNOWN,
    ON,
    OFF;

    public static PowerState parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return PowerState.valueOf(value.trim().toUpperCase());
    }
}
