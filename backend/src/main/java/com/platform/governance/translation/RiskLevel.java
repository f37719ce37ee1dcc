package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");
    
    private final String value;
    
    RiskLevel(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public static RiskLevel fromScore(int score) {
        if (score >= 10) {
            return CRITICAL;
        }
        if (score >= 5) {
            return HIGH;
        }
        if (score >= 2) {
            return MEDIUM;
        }
        return LOW;
    }
}
