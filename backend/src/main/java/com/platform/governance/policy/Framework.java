package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulatory frameworks and standards whose controls are tracked.
 */
public enum Framework {
    HIPAA("HIPAA"),
    NIST_AI_RMF("NIST_AI_RMF"),
    FDA_SAMD("FDA_SaMD"),
    ISO_42001("ISO_42001"),
    CA_SB1047("CA_SB1047"),
    NYC_LL144("NYC_LL144");
    
    private final String value;
    
    Framework(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * State or city laws apply only inside their jurisdiction and in-force window.
     */
    public boolean isStateLaw() {
        return this == CA_SB1047 || this == NYC_LL144;
    }
    
    @JsonCreator
    public static Framework fromValue(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim();
        for (Framework framework : values()) {
            if (framework.value.equalsIgnoreCase(candidate) || framework.name().equalsIgnoreCase(candidate)) {
                return framework;
            }
        }
        throw new IllegalArgumentException("Unknown framework: " + value);
    }
}
