package com.platform.governance.observability;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    
    POLICY_VERSION_CREATED("policy.version.created"),
    POLICY_VERSION_ROLLED_BACK("policy.version.rolled_back"),
    POLICY_INTEGRITY_FAILURE("policy.integrity.failure"),
    POLICY_SEEDED("policy.seeded"),
    
    TRANSLATION_COMPLETED("translation.completed"),
    TRANSLATION_FAILED("translation.failed"),
    TRANSLATION_PERSISTED("translation.persisted");
    
    private final String value;
    
    LogEventType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
