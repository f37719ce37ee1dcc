package com.platform.governance.config;

import com.platform.governance.policy.Framework;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.translation.ActionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.platform.governance.policy.Framework.CA_SB1047;
import static com.platform.governance.policy.Framework.FDA_SAMD;
import static com.platform.governance.policy.Framework.HIPAA;
import static com.platform.governance.policy.Framework.ISO_42001;
import static com.platform.governance.policy.Framework.NIST_AI_RMF;
import static com.platform.governance.policy.Framework.NYC_LL144;

/**
 * Configuration properties bound from the {@code governance.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {
    
    private Encryption encryption = new Encryption();
    
    private Policy policy = new Policy();
    
    private Classifier classifier = new Classifier();
    
    private Planner planner = new Planner();
    
    private Thresholds thresholds = new Thresholds();
    
    /**
     * In-force window of each state or city AI law, keyed by framework.
     */
    private Map<Framework, StateLaw> stateLaws = defaultStateLaws();
    
    /**
     * Deployment context of known AI systems, keyed by AI system id.
     */
    private Map<String, AiSystem> aiSystems = new LinkedHashMap<>();
    
    @Data
    public static class Encryption {
        /**
         * Passphrase the AES-256 policy key is derived from. Required for any policy read or write.
         */
        private String key;
    }
    
    @Data
    public static class Policy {
        /**
         * Policy store backend: {@code jpa} or {@code memory}.
         */
        private String store = "jpa";
        
        /**
         * Seed the baseline policy catalog at startup for keys without an active version.
         */
        private boolean seedDefaults = false;
        
        private String seedActor = "system";
    }
    
    @Data
    public static class Classifier {
        /**
         * Ordered frameworks that apply to each event type.
         */
        private Map<EventType, List<Framework>> applicability = defaultApplicability();
        
        /**
         * Payload boolean fields that indicate PHI involvement.
         */
        private List<String> phiIndicatorFields = new ArrayList<>(List.of("phi_detected", "containsPhi", "phiInvolved"));
    }
    
    @Data
    public static class Planner {
        private Duration criticalResponse = Duration.ofHours(4);
        private Duration highResponse = Duration.ofDays(1);
        private Duration mediumResponse = Duration.ofDays(7);
        
        /**
         * Deadline of automated hook actions.
         */
        private Duration automatedResponse = Duration.ofMinutes(15);
        
        /**
         * Action types with a registered automation hook.
         */
        private Set<ActionType> automationHooks = EnumSet.of(ActionType.RESTRICT, ActionType.NOTIFY);
    }
    
    @Data
    public static class Thresholds {
        /**
         * Per-organization threshold overrides keyed by health system id, then by
         * threshold name (e.g. {@code drift.accuracyDropHigh}).
         */
        private Map<String, Map<String, BigDecimal>> organizations = new LinkedHashMap<>();
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StateLaw {
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate effectiveDate;
        
        /**
         * Last day the law applies. Null while it has no sunset.
         */
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate sunsetDate;
    }
    
    @Data
    public static class AiSystem {
        private String name;
        private String department;
        
        /**
         * State or city the system is deployed in (e.g. {@code CA}, {@code nyc}).
         */
        private String location;
        
        private boolean highRisk;
        
        /**
         * Used for hiring or other employment decisions.
         */
        private boolean employmentAi;
    }
    
    static Map<Framework, StateLaw> defaultStateLaws() {
        Map<Framework, StateLaw> laws = new EnumMap<>(Framework.class);
        laws.put(CA_SB1047, new StateLaw(LocalDate.of(2024, 1, 1), null));
        laws.put(NYC_LL144, new StateLaw(LocalDate.of(2023, 7, 5), null));
        return laws;
    }
    
    static Map<EventType, List<Framework>> defaultApplicability() {
        Map<EventType, List<Framework>> table = new EnumMap<>(EventType.class);
        table.put(EventType.ALERT, List.of(NIST_AI_RMF));
        table.put(EventType.RUN, List.of(NIST_AI_RMF));
        table.put(EventType.TRACE, List.of(NIST_AI_RMF));
        table.put(EventType.GENERATION, List.of(NIST_AI_RMF));
        table.put(EventType.SCORE, List.of(NIST_AI_RMF));
        table.put(EventType.HIGH_LATENCY, List.of(NIST_AI_RMF));
        table.put(EventType.DATA_QUALITY_DEGRADATION, List.of(NIST_AI_RMF));
        table.put(EventType.DRIFT, List.of(NIST_AI_RMF, FDA_SAMD));
        table.put(EventType.MODEL_DRIFT, List.of(NIST_AI_RMF, FDA_SAMD));
        table.put(EventType.PERFORMANCE_DEGRADATION, List.of(NIST_AI_RMF, FDA_SAMD));
        table.put(EventType.ERROR, List.of(NIST_AI_RMF, FDA_SAMD));
        table.put(EventType.HARMFUL_OUTPUT, List.of(NIST_AI_RMF, FDA_SAMD));
        table.put(EventType.BIAS, List.of(NIST_AI_RMF, NYC_LL144));
        table.put(EventType.TRAINING_COMPLETE, List.of(FDA_SAMD, NIST_AI_RMF, ISO_42001));
        table.put(EventType.PATIENT_ACCESS, List.of(HIPAA));
        table.put(EventType.CLINICAL_DATA_ACCESS, List.of(HIPAA));
        table.put(EventType.UNAUTHORIZED_DATA_ACCESS, List.of(HIPAA));
        table.put(EventType.PHI_EXPOSURE, List.of(HIPAA, CA_SB1047));
        table.put(EventType.PROMPT_INJECTION_ATTEMPT, List.of(NIST_AI_RMF, ISO_42001));
        table.put(EventType.CLINICAL_ACCURACY_FAILURE, List.of(FDA_SAMD, NIST_AI_RMF));
        return table;
    }
}
