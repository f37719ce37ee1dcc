package com.platform.governance.error;

/**
 * Exception raised when policy content cannot be converted to or from JSON.
 */
public class SerializationException extends GovernanceException {
    
    public SerializationException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_ERROR, message, cause);
    }
}
