package com.platform.governance.translation;

import com.platform.governance.policy.PolicyKey;
import com.platform.governance.policy.PolicyRule;
import com.platform.governance.policy.PolicyStore;
import com.platform.governance.policy.ThresholdLookup;
import com.platform.governance.policy.ThresholdProfiles;
import com.platform.governance.policy.VerifiedPolicy;
import com.platform.governance.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Evaluates verified policy rules against an event and produces violation snapshots.
 */
@Slf4j
@Component
public class ViolationDeriver {
    
    private static final Comparator<ComplianceViolation> BY_CONTROL_ID = 
        Comparator.comparing(ComplianceViolation::getControlId);
    
    private final PolicyStore policyStore;
    private final ThresholdProfiles thresholdProfiles;
    
    public ViolationDeriver(PolicyStore policyStore, ThresholdProfiles thresholdProfiles) {
        this.policyStore = policyStore;
        this.thresholdProfiles = thresholdProfiles;
    }
    
    /**
     * Violations for a single key, ordered by controlId. Empty when the key has no
     * active policy. Rules sharing a controlId collapse to the most severe match.
     * 
     * @throws com.platform.governance.error.PolicyIntegrityException if the active policy fails verification
     */
    public List<ComplianceViolation> deriveViolations(TelemetryEvent event, PolicyKey key) {
        Optional<VerifiedPolicy> policy = policyStore.getActiveVerifiedPolicy(key);
        if (policy.isEmpty()) {
            log.debug("No active policy for {}, skipping", key);
            return List.of();
        }
        
        ThresholdLookup thresholds = thresholdProfiles.forOrganization(event.getHealthSystemId());
        Map<String, ComplianceViolation> byControl = new LinkedHashMap<>();
        for (PolicyRule rule : policy.get().ruleLogic().getRules()) {
            if (!rule.matches(event, thresholds)) {
                continue;
            }
            ComplianceViolation violation = buildViolation(event, rule, policy.get());
            String dedupKey = violation.getFramework() + "|" + violation.getControlId();
            byControl.merge(dedupKey, violation, ViolationDeriver::moreSevere);
        }
        
        List<ComplianceViolation> violations = new ArrayList<>(byControl.values());
        violations.sort(BY_CONTROL_ID);
        return violations;
    }
    
    /**
     * Derives across all keys, deduplicating on (framework, controlId) over the whole call.
     * Output follows the order of the key that produced each surviving violation, then controlId.
     */
    public List<ComplianceViolation> deriveAll(TelemetryEvent event, List<PolicyKey> keys) {
        Map<String, ComplianceViolation> selected = new LinkedHashMap<>();
        Map<String, Integer> keyIndex = new LinkedHashMap<>();
        
        for (int i = 0; i < keys.size(); i++) {
            for (ComplianceViolation violation : deriveViolations(event, keys.get(i))) {
                String dedupKey = violation.getFramework() + "|" + violation.getControlId();
                ComplianceViolation existing = selected.get(dedupKey);
                if (existing == null || violation.getSeverity().isHigherThan(existing.getSeverity())) {
                    selected.put(dedupKey, violation);
                    keyIndex.put(dedupKey, i);
                }
            }
        }
        
        List<ComplianceViolation> result = new ArrayList<>(selected.values());
        result.sort(Comparator
            .comparing((ComplianceViolation v) -> keyIndex.get(v.getFramework() + "|" + v.getControlId()))
            .thenComparing(BY_CONTROL_ID));
        return List.copyOf(result);
    }
    
    private ComplianceViolation buildViolation(TelemetryEvent event, PolicyRule rule, VerifiedPolicy policy) {
        Instant detectedAt = event.getProcessedAt();
        Instant reportingDeadline = null;
        if (rule.isRequiresReporting() && rule.getReportingDeadlineDays() != null && detectedAt != null) {
            reportingDeadline = detectedAt.plus(Duration.ofDays(rule.getReportingDeadlineDays()));
        }
        
        return ComplianceViolation.builder()
            .id(violationId(event.getId(), rule))
            .telemetryEventId(event.getId())
            .aiSystemId(event.getAiSystemId())
            .framework(rule.getFramework())
            .controlId(rule.getControlId())
            .controlName(rule.getControlName())
            .violationType(rule.getViolationType())
            .severity(rule.getSeverity())
            .requiresReporting(rule.isRequiresReporting())
            .reportingDeadline(reportingDeadline)
            .description(describe(event, rule))
            .remediationSteps(List.copyOf(rule.getRemediationSteps()))
            .policyVersion(policy.version().toString())
            .detectedAt(detectedAt)
            .resolved(false)
            .build();
    }
    
    private static String describe(TelemetryEvent event, PolicyRule rule) {
        StringBuilder description = new StringBuilder()
            .append(rule.getFramework().getValue()).append(' ')
            .append(rule.getControlId()).append(" (").append(rule.getControlName()).append(") violated by ")
            .append(event.getEventType().getValue()).append(" event");
        if (event.getSource() != null) {
            description.append(" from ").append(event.getSource());
        }
        if (event.getMetric() != null) {
            description.append(": ").append(event.getMetric());
            if (event.getMetricValue() != null) {
                description.append('=').append(event.getMetricValue());
            }
            if (event.getThreshold() != null) {
                description.append(" (threshold ").append(event.getThreshold()).append(')');
            }
        }
        if (rule.getThresholdLogic() != null) {
            description.append(" [").append(rule.getThresholdLogic().describe()).append(']');
        }
        return description.toString();
    }
    
    static String violationId(String eventId, PolicyRule rule) {
        String seed = eventId + "|" + rule.getFramework().getValue() + "|" + rule.getControlId();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
    
    private static ComplianceViolation moreSevere(ComplianceViolation current, ComplianceViolation candidate) {
        return candidate.getSeverity().isHigherThan(current.getSeverity()) ? candidate : current;
    }
}
