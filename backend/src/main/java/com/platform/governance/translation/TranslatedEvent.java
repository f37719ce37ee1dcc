package com.platform.governance.translation;

import com.platform.governance.telemetry.TelemetryEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one translate() call. Each action list belongs to exactly one violation.
 */
@Value
public class TranslatedEvent {
    
    TelemetryEvent event;
    
    List<ComplianceViolation> violations;
    
    /**
     * Violation id to that violation's actions, in violation order.
     */
    Map<String, List<RequiredAction>> actionsByViolation;
    
    RiskAssessment riskAssessment;
    
    Instant translatedAt;
    
    @Builder
    public TranslatedEvent(TelemetryEvent event, List<ComplianceViolation> violations,
            Map<String, List<RequiredAction>> actionsByViolation, RiskAssessment riskAssessment, 
            Instant translatedAt) {
        this.event = event;
        this.violations = List.copyOf(violations);
        Map<String, List<RequiredAction>> copy = new LinkedHashMap<>();
        actionsByViolation.forEach((violationId, actions) -> copy.put(violationId, List.copyOf(actions)));
        this.actionsByViolation = Collections.unmodifiableMap(copy);
        this.riskAssessment = riskAssessment;
        this.translatedAt = translatedAt;
    }
    
    public List<RequiredAction> actionsFor(ComplianceViolation violation) {
        return actionsByViolation.getOrDefault(violation.getId(), List.of());
    }
    
    public List<RequiredAction> allActions() {
        return violations.stream()
            .flatMap(violation -> actionsFor(violation).stream())
            .toList();
    }
    
    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
