package com.platform.governance.error;

/**
 * Rejected input. Always raised before anything is encrypted or stored.
 * {@code field} names the offending request field or rule-logic path.
 */
public class ValidationException extends GovernanceException {
    
    private final String field;
    private final Object rejectedValue;
    
    private ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public static ValidationException missing(String field) {
        return new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field, null,
            String.format("'%s' is required", field));
    }
    
    public static ValidationException invalidValue(String field, Object rejectedValue, String reason) {
        return new ValidationException(ErrorCode.INVALID_FIELD_VALUE, field, rejectedValue,
            String.format("'%s' rejected for %s: %s", rejectedValue, field, reason));
    }
    
    public static ValidationException invalidRuleLogic(String path, String reason) {
        return new ValidationException(ErrorCode.INVALID_RULE_LOGIC, path, null,
            String.format("Invalid rule logic at '%s': %s", path, reason));
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
