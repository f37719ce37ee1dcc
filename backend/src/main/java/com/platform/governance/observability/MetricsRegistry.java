package com.platform.governance.observability;

import com.platform.governance.error.ErrorCode;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for governance metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record a translate() call and its duration.
     */
    public void recordTranslation(String eventType, boolean success, long durationMs) {
        incrementCounter("governance.translation.total", 
            "event_type", eventType, "success", String.valueOf(success));
        
        String timerKey = "translation." + success;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("governance.translation.duration")
                .tag("success", String.valueOf(success))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
    }
    
    public void recordViolation(Framework framework, Severity severity) {
        incrementCounter("governance.violations.total", 
            "framework", framework.getValue(), "severity", severity.getValue());
    }
    
    public void recordIntegrityFailure(String policyKey) {
        incrementCounter("governance.policy.integrity.failures", "policy_key", policyKey);
    }
    
    public void recordPolicyVersionCreated(String policyKey, String changeType) {
        incrementCounter("governance.policy.versions.created", 
            "policy_key", policyKey, "change_type", changeType);
    }
    
    public void recordError(ErrorCode errorCode) {
        incrementCounter("governance.errors.total", 
            "code", errorCode.getCode(), "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
