package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human role responsible for a required action.
 */
public enum Assignee {
    CISO("ciso"),
    COMPLIANCE_OFFICER("compliance_officer"),
    CLINICAL_OWNER("clinical_owner"),
    IT_OWNER("it_owner"),
    PRIVACY_OFFICER("privacy_officer");
    
    private final String value;
    
    Assignee(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static Assignee fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Assignee candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown assignee: " + value);
    }
}
