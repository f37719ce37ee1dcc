package com.platform.governance.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logger for policy lifecycle and translation outcomes.
 * 
 * All logs are JSON-formatted and machine-parsable.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(
            @Value("${spring.application.name:ai-governance-platform}") String serviceName,
            @Value("${governance.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    public PolicyLogger policy() {
        return new PolicyLogger(serviceName, environment);
    }
    
    public TranslationLogger translation() {
        return new TranslationLogger(serviceName, environment);
    }
    
    // ==================== POLICY LOGGER ====================
    
    public static class PolicyLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.policy");
        private final String service;
        private final String environment;
        
        PolicyLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void versionCreated(String policyVersionId, String policyKey, String version,
                String previousVersion, String actor) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("previous_version", previousVersion != null ? previousVersion : "none");
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.POLICY_VERSION_CREATED, "INFO")
                .actor(actor)
                .policyVersionId(policyVersionId)
                .policyKey(policyKey)
                .version(version)
                .success(true)
                .context(context)
                .build();
            log.info(event.toJson());
        }
        
        public void rolledBack(String policyVersionId, String policyKey, String version,
                String restoredVersion, String actor) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.POLICY_VERSION_ROLLED_BACK, "INFO")
                .actor(actor)
                .policyVersionId(policyVersionId)
                .policyKey(policyKey)
                .version(version)
                .message("Restored content of version " + restoredVersion)
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void integrityFailure(String policyVersionId, String policyKey, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.POLICY_INTEGRITY_FAILURE, "ERROR")
                .actor("system")
                .policyVersionId(policyVersionId)
                .policyKey(policyKey)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void seeded(int created, int skipped) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.POLICY_SEEDED, "INFO")
                .actor("system")
                .context(Map.of("created", created, "skipped", skipped))
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== TRANSLATION LOGGER ====================
    
    public static class TranslationLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.translation");
        private final String service;
        private final String environment;
        
        TranslationLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void completed(String eventType, int frameworks, int violations, int actions,
                String riskLevel, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.TRANSLATION_COMPLETED, "INFO")
                .actor("system")
                .success(true)
                .durationMs(durationMs)
                .context(Map.of(
                    "event_type", eventType,
                    "frameworks", frameworks,
                    "violations", violations,
                    "actions", actions,
                    "risk_level", riskLevel
                ))
                .build();
            log.info(event.toJson());
        }
        
        public void failed(String eventType, String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.TRANSLATION_FAILED, "ERROR")
                .actor("system")
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .context(Map.of("event_type", eventType != null ? eventType : "unknown"))
                .build();
            log.error(event.toJson());
        }
        
        public void persisted(String eventId, int violations, int actions) {
            StructuredLogEvent event = StructuredLogEvent.start(service, environment, 
                    LogEventType.TRANSLATION_PERSISTED, "INFO")
                .actor("system")
                .success(true)
                .context(Map.of(
                    "telemetry_event_id", eventId,
                    "violations", violations,
                    "actions", actions
                ))
                .build();
            log.info(event.toJson());
        }
    }
}
