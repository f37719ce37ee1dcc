package com.platform.governance.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.platform.governance.policy.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Optional;

/**
 * Normalized representation of an inbound AI telemetry signal.
 * Created by the ingestion boundary and never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TelemetryEvent {
    
    String id;
    
    String aiSystemId;
    
    /**
     * Organization operating the AI system. Selects its threshold overrides; null means defaults.
     */
    String healthSystemId;
    
    EventType eventType;
    
    /**
     * Originating platform (langsmith, arize, langfuse, wandb, epic, ...).
     */
    String source;
    
    /**
     * Severity reported by the source, if any.
     */
    Severity severity;
    
    String metric;
    
    String metricValue;
    
    String threshold;
    
    /**
     * Opaque vendor payload after normalization.
     */
    @Builder.Default
    JsonNode payload = JsonNodeFactory.instance.objectNode();
    
    Instant processedAt;
    
    /**
     * Resolves a dotted path (e.g. {@code model.drift.score}) inside the payload.
     */
    public Optional<JsonNode> payloadValue(String dottedPath) {
        if (payload == null || dottedPath == null || dottedPath.isBlank()) {
            return Optional.empty();
        }
        JsonNode node = payload.at("/" + dottedPath.replace('.', '/'));
        return node.isMissingNode() || node.isNull() ? Optional.empty() : Optional.of(node);
    }
}
