package com.platform.governance.error;

/**
 * Raised when decrypted policy content does not verify against its stored hash,
 * or when the ciphertext fails authentication. Indicates possible tampering.
 * Never logged-and-ignored: translation for the affected key must stop.
 */
public class PolicyIntegrityException extends GovernanceException {
    
    private final String policyVersionId;
    
    public PolicyIntegrityException(String policyVersionId, String message) {
        super(ErrorCode.POLICY_INTEGRITY_VIOLATION, message);
        this.policyVersionId = policyVersionId;
    }
    
    public PolicyIntegrityException(String policyVersionId, String message, Throwable cause) {
        super(ErrorCode.POLICY_INTEGRITY_VIOLATION, message, cause);
        this.policyVersionId = policyVersionId;
    }
    
    public String getPolicyVersionId() {
        return policyVersionId;
    }
}
