package com.platform.governance.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Value;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * One machine-parsable log line, written in snake_case.
 * Correlation, event and AI system ids are copied from the MDC when the event is started.
 * Policy content never appears here, only ids, keys and versions.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();
    
    Instant timestamp;
    String level;
    String service;
    String environment;
    LogEventType eventType;
    String actor;
    
    String correlationId;
    String eventId;
    String aiSystemId;
    
    String message;
    String policyVersionId;
    String policyKey;
    String version;
    Boolean success;
    Long durationMs;
    String errorCode;
    String errorMessage;
    
    Map<String, Object> context;
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            // still emit a parsable line naming the event
            return "{\"event_type\":\"" + eventType.getValue() + "\",\"serialization_error\":\"" 
                + String.valueOf(e.getOriginalMessage()).replace('"', '\'') + "\"}";
        }
    }
    
    public static StructuredLogEventBuilder start(String service, String environment, 
            LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .correlationId(MDC.get(LoggingConfig.MDC_CORRELATION_ID))
            .eventId(MDC.get(LoggingConfig.MDC_EVENT_ID))
            .aiSystemId(MDC.get(LoggingConfig.MDC_AI_SYSTEM_ID));
    }
}
