package com.platform.governance.translation;

/**
 * Durable storage for translation output, owned by the caller of the engine.
 */
public interface ComplianceRecordStore {
    
    /**
     * @return the persisted violation id
     */
    String createComplianceViolation(ComplianceViolation violation);
    
    /**
     * @param action action whose violationId is the persisted id returned for its violation
     */
    void createRequiredAction(RequiredAction action);
}
