package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a policy version. Transitions only go ACTIVE -> DEPRECATED.
 */
public enum PolicyStatus {
    ACTIVE("active"),
    DEPRECATED("deprecated");
    
    private final String value;
    
    PolicyStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
