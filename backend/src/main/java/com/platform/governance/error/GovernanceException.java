package com.platform.governance.error;

/**
 * Root of every exception the policy store and translation engine raise on purpose.
 */
public abstract class GovernanceException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected GovernanceException(ErrorCode errorCode, String message) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected GovernanceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
