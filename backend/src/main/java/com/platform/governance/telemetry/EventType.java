package com.platform.governance.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Normalized telemetry event types produced by the ingestion boundary.
 */
public enum EventType {
    // Generic observability signals
    ALERT("alert"),
    DRIFT("drift"),
    BIAS("bias"),
    RUN("run"),
    ERROR("error"),
    TRACE("trace"),
    GENERATION("generation"),
    SCORE("score"),
    TRAINING_COMPLETE("training_complete"),
    
    // EHR access signals
    PATIENT_ACCESS("patient_access"),
    CLINICAL_DATA_ACCESS("clinical_data_access"),
    
    // Privacy
    PHI_EXPOSURE("phi_exposure"),
    UNAUTHORIZED_DATA_ACCESS("unauthorized_data_access"),
    
    // Security
    PROMPT_INJECTION_ATTEMPT("prompt_injection_attempt"),
    
    // Performance
    MODEL_DRIFT("model_drift"),
    PERFORMANCE_DEGRADATION("performance_degradation"),
    HIGH_LATENCY("high_latency"),
    
    // Safety
    CLINICAL_ACCURACY_FAILURE("clinical_accuracy_failure"),
    HARMFUL_OUTPUT("harmful_output"),
    
    // Quality
    DATA_QUALITY_DEGRADATION("data_quality_degradation");
    
    private static final Map<String, EventType> LEGACY_ALIASES = Map.of(
        "phi_leakage", PHI_EXPOSURE,
        "latency", HIGH_LATENCY
    );
    
    private final String value;
    
    EventType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Resolves a wire value, accepting legacy aliases and any letter case.
     */
    @JsonCreator
    public static EventType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim().toLowerCase();
        for (EventType type : values()) {
            if (type.value.equals(candidate)) {
                return type;
            }
        }
        EventType alias = LEGACY_ALIASES.get(candidate);
        if (alias != null) {
            return alias;
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
