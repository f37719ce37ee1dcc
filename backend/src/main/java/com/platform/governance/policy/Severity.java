package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of violation severity levels, ordered from least to most severe.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");
    
    private final String value;
    
    Severity(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean isHigherThan(Severity other) {
        return other == null || this.compareTo(other) > 0;
    }
    
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
