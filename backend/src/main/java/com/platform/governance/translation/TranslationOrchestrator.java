package com.platform.governance.translation;

import com.platform.governance.error.ErrorCode;
import com.platform.governance.error.GovernanceException;
import com.platform.governance.error.ValidationException;
import com.platform.governance.observability.LoggingConfig;
import com.platform.governance.observability.MetricsRegistry;
import com.platform.governance.observability.StructuredLogger;
import com.platform.governance.policy.PolicyKey;
import com.platform.governance.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the translation engine: telemetry event in, violations and their
 * actions out.
 * 
 * Holds no mutable state, so calls for different events run in parallel. The
 * same event and policy state always produce the same result, ids included.
 * Any collaborator failure aborts the whole call.
 * 
 * Deadlines are derived from the event's processedAt, so an event without it is
 * rejected rather than stamped here.
 */
@Slf4j
@Service
public class TranslationOrchestrator {
    
    private final EventClassifier classifier;
    private final ViolationDeriver deriver;
    private final ActionPlanner planner;
    private final RiskAssessor riskAssessor;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    
    public TranslationOrchestrator(
            EventClassifier classifier,
            ViolationDeriver deriver,
            ActionPlanner planner,
            RiskAssessor riskAssessor,
            StructuredLogger structuredLogger,
            MetricsRegistry metricsRegistry) {
        this.classifier = classifier;
        this.deriver = deriver;
        this.planner = planner;
        this.riskAssessor = riskAssessor;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
    }
    
    public TranslatedEvent translate(TelemetryEvent event) {
        long start = System.nanoTime();
        String eventType = event.getEventType() != null ? event.getEventType().getValue() : "unknown";
        LoggingConfig.setEventContext(event.getId(), event.getAiSystemId());
        try {
            if (event.getProcessedAt() == null) {
                throw ValidationException.missing("processedAt");
            }
            List<PolicyKey> keys = classifier.resolveKeys(event);
            log.debug("Event {} resolved to policy keys {}", event.getId(), keys);
            
            List<ComplianceViolation> violations = deriver.deriveAll(event, keys);
            
            Map<String, List<RequiredAction>> actionsByViolation = new LinkedHashMap<>();
            int actionCount = 0;
            for (ComplianceViolation violation : violations) {
                List<RequiredAction> actions = planner.planActions(violation);
                actionsByViolation.put(violation.getId(), actions);
                actionCount += actions.size();
            }
            
            RiskAssessment risk = riskAssessor.assess(event, violations);
            
            TranslatedEvent result = TranslatedEvent.builder()
                .event(event)
                .violations(violations)
                .actionsByViolation(actionsByViolation)
                .riskAssessment(risk)
                .translatedAt(event.getProcessedAt())
                .build();
            
            long durationMs = elapsedMs(start);
            violations.forEach(v -> metricsRegistry.recordViolation(v.getFramework(), v.getSeverity()));
            metricsRegistry.recordTranslation(eventType, true, durationMs);
            structuredLogger.translation().completed(eventType, keys.size(), violations.size(), 
                actionCount, risk.level().getValue(), durationMs);
            return result;
            
        } catch (RuntimeException e) {
            long durationMs = elapsedMs(start);
            ErrorCode errorCode = e instanceof GovernanceException ge ? ge.getErrorCode() : ErrorCode.TRANSLATION_FAILED;
            metricsRegistry.recordTranslation(eventType, false, durationMs);
            metricsRegistry.recordError(errorCode);
            structuredLogger.translation().failed(eventType, errorCode.getCode(), e.getMessage(), durationMs);
            throw e;
        } finally {
            LoggingConfig.clearEventContext();
        }
    }
    
    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
