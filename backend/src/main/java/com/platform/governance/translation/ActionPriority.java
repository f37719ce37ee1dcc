package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action priority, most pressing first. Declaration order is the sort order.
 */
public enum ActionPriority {
    IMMEDIATE("immediate"),
    URGENT("urgent"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");
    
    private final String value;
    
    ActionPriority(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static ActionPriority fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ActionPriority candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown actionPriority: " + value);
    }
}
