package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of remediation work a required action represents.
 */
public enum ActionType {
    ROLLBACK("rollback"),
    NOTIFY("notify"),
    DOCUMENT("document"),
    ESCALATE("escalate"),
    RESTRICT("restrict"),
    REMEDIATE("remediate");
    
    private final String value;
    
    ActionType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static ActionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ActionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown actionType: " + value);
    }
}
