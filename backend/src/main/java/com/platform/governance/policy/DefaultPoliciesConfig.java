package com.platform.governance.policy;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.observability.StructuredLogger;
import com.platform.governance.telemetry.EventType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the baseline policy catalog for keys that have no active version yet.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "governance.policy.seed-defaults", havingValue = "true")
public class DefaultPoliciesConfig {
    
    static final String SEED_REASON = "Baseline policy catalog";
    
    private final PolicyStore policyStore;
    private final GovernanceProperties properties;
    private final StructuredLogger structuredLogger;
    
    @PostConstruct
    public void initializeDefaultPolicies() {
        log.info("Initializing default policies...");
        String actor = properties.getPolicy().getSeedActor();
        
        int created = 0;
        int skipped = 0;
        for (Map.Entry<PolicyKey, PolicyRuleLogic> entry : defaultCatalog().entrySet()) {
            PolicyKey key = entry.getKey();
            if (policyStore.hasActivePolicy(key)) {
                log.debug("Policy {} already active, not seeding", key);
                skipped++;
                continue;
            }
            policyStore.createPolicyVersion(key.eventType(), key.framework(), VersionBump.MAJOR, 
                entry.getValue(), actor, SEED_REASON);
            created++;
        }
        
        structuredLogger.policy().seeded(created, skipped);
    }
    
    static Map<PolicyKey, PolicyRuleLogic> defaultCatalog() {
        Map<PolicyKey, PolicyRuleLogic> catalog = new LinkedHashMap<>();
        
        // HIPAA breach notification: 60 days to notify affected individuals
        catalog.put(PolicyKey.of(EventType.PHI_EXPOSURE, Framework.HIPAA), logic(PolicyRule.builder()
            .framework(Framework.HIPAA)
            .controlId("164.402")
            .controlName("Breach Notification")
            .violationType("phi_breach")
            .severity(Severity.CRITICAL)
            .requiresReporting(true)
            .reportingDeadlineDays(60)
            .remediationSteps(List.of(
                "Notify Privacy Officer and begin breach investigation protocol",
                "Document breach scope, affected individuals and timeline for HHS reporting",
                "Restrict AI system access to PHI until investigation completes"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.PATIENT_ACCESS, Framework.HIPAA), logic(PolicyRule.builder()
            .framework(Framework.HIPAA)
            .controlId("164.312(a)")
            .controlName("Access Control")
            .violationType("unauthorized_phi_access")
            .severity(Severity.HIGH)
            .requiresReporting(false)
            .thresholdLogic(new ThresholdCondition.Compare("payload.unauthorized", 
                ThresholdCondition.Operator.GTE, BigDecimal.ONE))
            .remediationSteps(List.of(
                "Revoke access credentials used for the unauthorized request",
                "Review access control configuration of the AI system"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.DRIFT, Framework.NIST_AI_RMF), logic(PolicyRule.builder()
            .framework(Framework.NIST_AI_RMF)
            .controlId("MANAGE-4.1")
            .controlName("Post-deployment monitoring")
            .violationType("model_drift")
            .severity(Severity.HIGH)
            .requiresReporting(false)
            .thresholdLogic(new ThresholdCondition.ExceedsThreshold(BigDecimal.ZERO))
            .remediationSteps(List.of(
                "Escalate performance degradation to the AI governance committee",
                "Update AI risk register with drift findings"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.BIAS, Framework.NIST_AI_RMF), logic(PolicyRule.builder()
            .framework(Framework.NIST_AI_RMF)
            .controlId("MEASURE-2.1")
            .controlName("Fairness evaluation")
            .violationType("bias_detected")
            .severity(Severity.MEDIUM)
            .requiresReporting(false)
            .thresholdLogic(new ThresholdCondition.ExceedsThreshold(BigDecimal.ZERO))
            .remediationSteps(List.of(
                "Document bias audit with demographic disparity analysis"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.BIAS, Framework.NYC_LL144), logic(PolicyRule.builder()
            .framework(Framework.NYC_LL144)
            .controlId("NYC-LL144-1")
            .controlName("Bias Audit Requirement")
            .violationType("employment_bias")
            .severity(Severity.HIGH)
            .requiresReporting(true)
            .reportingDeadlineDays(90)
            .thresholdLogic(new ThresholdCondition.ConfiguredThreshold(ThresholdCondition.FIELD_METRIC_VALUE,
                ThresholdCondition.Operator.GT, "bias.varianceNYC"))
            .remediationSteps(List.of(
                "Commission an independent bias audit of the employment decision tool",
                "Publish the audit summary and notify candidates of automated screening"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.PHI_EXPOSURE, Framework.CA_SB1047), logic(PolicyRule.builder()
            .framework(Framework.CA_SB1047)
            .controlId("CA-SB1047-2")
            .controlName("Incident Reporting")
            .violationType("safety_incident")
            .severity(Severity.CRITICAL)
            .requiresReporting(true)
            .reportingDeadlineDays(10)
            .remediationSteps(List.of(
                "Report the safety incident to the California Attorney General",
                "Suspend the AI system until the incident review completes"))
            .build()));
        
        catalog.put(PolicyKey.of(EventType.DRIFT, Framework.FDA_SAMD), logic(PolicyRule.builder()
            .framework(Framework.FDA_SAMD)
            .controlId("FDA-PCCP-2")
            .controlName("Predetermined Change Control Plan")
            .violationType("unapproved_performance_change")
            .severity(Severity.HIGH)
            .requiresReporting(true)
            .reportingDeadlineDays(30)
            .thresholdLogic(new ThresholdCondition.ExceedsThreshold(BigDecimal.valueOf(50)))
            .remediationSteps(List.of(
                "Rollback model to last validated version",
                "Document deviation from the change control plan"))
            .build()));
        
        return catalog;
    }
    
    private static PolicyRuleLogic logic(PolicyRule rule) {
        return PolicyRuleLogic.builder()
            .rules(List.of(rule))
            .metadata(PolicyRuleLogic.Metadata.builder()
                .author("system")
                .changeReason(SEED_REASON)
                .build())
            .build();
    }
}
