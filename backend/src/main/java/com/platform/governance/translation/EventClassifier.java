package com.platform.governance.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyKey;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.telemetry.TelemetryEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the (eventType, framework) policy keys that apply to a telemetry event.
 * Pure function of the event, the configured applicability table and the configured
 * state-law windows and AI system contexts.
 */
@Component
public class EventClassifier {
    
    private final Map<EventType, List<Framework>> applicability;
    private final List<String> phiIndicatorFields;
    private final StateLawApplicability stateLaws;
    
    public EventClassifier(GovernanceProperties properties, StateLawApplicability stateLaws) {
        this.applicability = properties.getClassifier().getApplicability();
        this.phiIndicatorFields = List.copyOf(properties.getClassifier().getPhiIndicatorFields());
        this.stateLaws = stateLaws;
    }
    
    /**
     * Ordered, duplicate-free policy keys for the event. HIPAA is appended when the
     * event indicates PHI involvement and the table did not already list it. State-law
     * frameworks are dropped when the law does not cover the event.
     */
    public List<PolicyKey> resolveKeys(TelemetryEvent event) {
        if (event.getEventType() == null) {
            return List.of();
        }
        Set<Framework> frameworks = new LinkedHashSet<>(
            applicability.getOrDefault(event.getEventType(), List.of()));
        if (indicatesPhi(event)) {
            frameworks.add(Framework.HIPAA);
        }
        
        List<PolicyKey> keys = new ArrayList<>(frameworks.size());
        for (Framework framework : frameworks) {
            if (!stateLaws.applies(framework, event)) {
                continue;
            }
            keys.add(PolicyKey.of(event.getEventType(), framework));
        }
        return List.copyOf(keys);
    }
    
    boolean indicatesPhi(TelemetryEvent event) {
        if (event.getMetric() != null && event.getMetric().toLowerCase(Locale.ROOT).contains("phi")) {
            return true;
        }
        for (String field : phiIndicatorFields) {
            if (event.payloadValue(field).map(EventClassifier::isTruthy).orElse(false)) {
                return true;
            }
        }
        return false;
    }
    
    private static boolean isTruthy(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isTextual() && "true".equalsIgnoreCase(node.asText().trim());
    }
}
