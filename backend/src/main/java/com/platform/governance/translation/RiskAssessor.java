package com.platform.governance.translation;

import com.platform.governance.policy.Framework;
import com.platform.governance.policy.Severity;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.telemetry.TelemetryEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores the violations of one event and decides whether leadership escalation is needed.
 */
@Component
public class RiskAssessor {
    
    static final String BREACH_NOTIFICATION_CONTROL = "164.402";
    
    public RiskAssessment assess(TelemetryEvent event, List<ComplianceViolation> violations) {
        long critical = count(violations, Severity.CRITICAL);
        long high = count(violations, Severity.HIGH);
        long medium = count(violations, Severity.MEDIUM);
        long low = count(violations, Severity.LOW);
        boolean reporting = violations.stream().anyMatch(ComplianceViolation::isRequiresReporting);
        
        int score = (int) (critical * 10 + high * 5 + medium * 2 + low);
        
        List<String> factors = new ArrayList<>();
        if (critical > 0) {
            factors.add(critical + " critical violation(s)");
        }
        if (high > 0) {
            factors.add(high + " high-severity violation(s)");
        }
        if (event.getEventType() == EventType.PHI_EXPOSURE) {
            factors.add("PHI breach detected");
        }
        if (reporting) {
            factors.add("Regulatory reporting required");
        }
        
        boolean escalationRequired = critical > 0 || high >= 2 || reporting;
        List<String> path = escalationRequired ? escalationPath(violations) : List.of();
        
        return new RiskAssessment(score, RiskLevel.fromScore(score), factors, escalationRequired, path);
    }
    
    private static List<String> escalationPath(List<ComplianceViolation> violations) {
        if (violations.stream().anyMatch(v -> BREACH_NOTIFICATION_CONTROL.equals(v.getControlId()))) {
            return List.of("Privacy Officer", "CISO", "Chief Compliance Officer", "Board");
        }
        if (violations.stream().anyMatch(v -> v.getFramework() == Framework.FDA_SAMD)) {
            return List.of("Chief Compliance Officer", "CISO", "Clinical Owner", "Board");
        }
        return List.of("CISO", "Chief Compliance Officer", "Board");
    }
    
    private static long count(List<ComplianceViolation> violations, Severity severity) {
        return violations.stream().filter(v -> v.getSeverity() == severity).count();
    }
}
