package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GoalStatus {
    PENDING, IN_PROGRESS, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Status only moves forward; terminal states never change. */
    public boolean canTransitionTo(GoalStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return target.ordinal() > ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GoalStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        return GoalStatus.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
