package com.platform.governance;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.crypto.PolicyCipher;
import com.platform.governance.crypto.Sha256PolicyHasher;
import com.platform.governance.observability.MetricsRegistry;
import com.platform.governance.observability.StructuredLogger;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyRule;
import com.platform.governance.policy.PolicyRuleCodec;
import com.platform.governance.policy.PolicyRuleLogic;
import com.platform.governance.policy.PolicyRuleValidator;
import com.platform.governance.policy.PolicyStore;
import com.platform.governance.policy.PolicyVersionRepository;
import com.platform.governance.policy.Severity;
import com.platform.governance.policy.ThresholdProfiles;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.telemetry.TelemetryEvent;
import com.platform.governance.translation.ActionPlanner;
import com.platform.governance.translation.EventClassifier;
import com.platform.governance.translation.RiskAssessor;
import com.platform.governance.translation.StateLawApplicability;
import com.platform.governance.translation.TranslationOrchestrator;
import com.platform.governance.translation.ViolationDeriver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared builders for unit tests.
 */
public final class GovernanceFixtures {
    
    public static final Instant NOW = Instant.parse("2025-03-14T09:26:53Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    
    private GovernanceFixtures() {
    }
    
    public static GovernanceProperties properties() {
        GovernanceProperties properties = new GovernanceProperties();
        properties.getEncryption().setKey("unit-test-passphrase");
        return properties;
    }
    
    public static StructuredLogger structuredLogger() {
        return new StructuredLogger("ai-governance-platform", "test");
    }
    
    public static MetricsRegistry metricsRegistry() {
        return new MetricsRegistry(new SimpleMeterRegistry());
    }
    
    public static PolicyStore policyStore(PolicyVersionRepository repository, PolicyCipher cipher, Clock clock) {
        return new PolicyStore(repository, cipher, new Sha256PolicyHasher(), new PolicyRuleCodec(),
            new PolicyRuleValidator(), structuredLogger(), metricsRegistry(), clock);
    }
    
    public static EventClassifier classifier(GovernanceProperties properties) {
        return new EventClassifier(properties, new StateLawApplicability(properties));
    }
    
    public static ViolationDeriver deriver(PolicyStore policyStore, GovernanceProperties properties) {
        return new ViolationDeriver(policyStore, new ThresholdProfiles(properties));
    }
    
    public static TranslationOrchestrator orchestrator(PolicyStore policyStore) {
        return orchestrator(policyStore, properties());
    }
    
    public static TranslationOrchestrator orchestrator(PolicyStore policyStore, GovernanceProperties properties) {
        return new TranslationOrchestrator(
            classifier(properties),
            deriver(policyStore, properties),
            new ActionPlanner(properties),
            new RiskAssessor(),
            structuredLogger(),
            metricsRegistry());
    }
    
    public static PolicyRule.PolicyRuleBuilder rule(Framework framework, String controlId, Severity severity) {
        return PolicyRule.builder()
            .framework(framework)
            .controlId(controlId)
            .controlName("Control " + controlId)
            .violationType("test_violation")
            .severity(severity)
            .requiresReporting(false);
    }
    
    public static PolicyRuleLogic logic(PolicyRule... rules) {
        return PolicyRuleLogic.builder()
            .rules(List.of(rules))
            .metadata(PolicyRuleLogic.Metadata.builder()
                .author("compliance-team")
                .changeReason("test")
                .build())
            .build();
    }
    
    public static TelemetryEvent.TelemetryEventBuilder event(EventType eventType) {
        return TelemetryEvent.builder()
            .id("evt-001")
            .aiSystemId("sys-radiology-01")
            .eventType(eventType)
            .source("arize")
            .payload(JsonNodeFactory.instance.objectNode())
            .processedAt(NOW);
    }
    
    /**
     * The drift event of the reference scenario: drift_score 0.35 against threshold 0.2.
     */
    public static TelemetryEvent driftEvent() {
        return event(EventType.DRIFT)
            .metric("drift_score")
            .metricValue("0.35")
            .threshold("0.2")
            .build();
    }
    
    public static ObjectNode payload() {
        return JsonNodeFactory.instance.objectNode();
    }
}
