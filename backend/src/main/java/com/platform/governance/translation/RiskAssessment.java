package com.platform.governance.translation;

import java.util.List;

/**
 * Aggregate risk of one translated event.
 * The escalation path is empty when no escalation is required.
 */
public record RiskAssessment(
    int score,
    RiskLevel level,
    List<String> factors,
    boolean escalationRequired,
    List<String> escalationPath
) {
    
    public RiskAssessment {
        factors = List.copyOf(factors);
        escalationPath = List.copyOf(escalationPath);
    }
}
