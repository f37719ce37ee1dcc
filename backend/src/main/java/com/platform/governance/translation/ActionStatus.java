package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution status of a required action. Planning always yields PENDING.
 */
public enum ActionStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");
    
    private final String value;
    
    ActionStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static ActionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ActionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown actionStatus: " + value);
    }
}
