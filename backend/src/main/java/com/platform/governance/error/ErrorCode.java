package com.platform.governance.error;

/**
 * Stable error codes returned to API clients, formatted GV-{group}{number}:
 * 1xx rejected input, 3xx missing policy or write conflict, 4xx storage,
 * 5xx policy integrity and translation, 9xx unexpected.
 * 
 * A fatal code means compliance output cannot be trusted until an operator intervenes.
 */
public enum ErrorCode {
    
    VALIDATION_ERROR("GV-100", "Validation error", false),
    INVALID_REQUEST("GV-101", "Request body could not be read", false),
    MISSING_REQUIRED_FIELD("GV-102", "Missing required field", false),
    INVALID_FIELD_VALUE("GV-103", "Invalid field value", false),
    INVALID_RULE_LOGIC("GV-110", "Invalid policy rule logic", false),
    
    POLICY_NOT_FOUND("GV-301", "No active policy", false),
    POLICY_VERSION_NOT_FOUND("GV-302", "Policy version not found", false),
    OPTIMISTIC_LOCK_FAILURE("GV-312", "Concurrent policy write", false),
    
    DATABASE_ERROR("GV-400", "Policy store error", true),
    
    POLICY_INTEGRITY_VIOLATION("GV-520", "Policy integrity verification failed", true),
    POLICY_ENCRYPTION_FAILED("GV-530", "Policy encryption failed", true),
    POLICY_DECRYPTION_FAILED("GV-531", "Policy decryption failed", true),
    TRANSLATION_FAILED("GV-540", "Telemetry translation failed", true),
    
    UNEXPECTED_ERROR("GV-901", "Unexpected error occurred", true),
    SERIALIZATION_ERROR("GV-903", "Policy content could not be serialized", false);
    
    private final String code;
    private final String defaultMessage;
    private final boolean fatal;
    
    ErrorCode(String code, String defaultMessage, boolean fatal) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.fatal = fatal;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public boolean isFatal() {
        return fatal;
    }
}
