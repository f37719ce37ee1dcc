package com.platform.governance.error;

/**
 * Raised when the encryption primitive itself fails (missing key, cipher unavailable).
 */
public class PolicyEncryptionException extends GovernanceException {
    
    public PolicyEncryptionException(String message) {
        super(ErrorCode.POLICY_ENCRYPTION_FAILED, message);
    }
    
    public PolicyEncryptionException(String message, Throwable cause) {
        super(ErrorCode.POLICY_ENCRYPTION_FAILED, message, cause);
    }
    
    public PolicyEncryptionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
