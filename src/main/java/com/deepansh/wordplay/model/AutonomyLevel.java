package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AutonomyLevel {
    CONSERVATIVE, MODERATE, AGGRESSIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AutonomyLevel fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        return AutonomyLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
