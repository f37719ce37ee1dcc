package com.platform.governance.translation;

import com.platform.governance.policy.Framework;
import com.platform.governance.policy.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a regulatory control breach derived from one telemetry event.
 * Later policy changes never alter an existing violation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ComplianceViolation {
    
    /**
     * Derived from telemetry event id, framework and control id, so retries yield the same id.
     */
    String id;
    
    String telemetryEventId;
    
    String aiSystemId;
    
    Framework framework;
    
    String controlId;
    
    String controlName;
    
    String violationType;
    
    Severity severity;
    
    boolean requiresReporting;
    
    Instant reportingDeadline;
    
    String description;
    
    @Builder.Default
    List<String> remediationSteps = List.of();
    
    /**
     * Policy version that produced this violation.
     */
    String policyVersion;
    
    Instant detectedAt;
    
    boolean resolved;
}
