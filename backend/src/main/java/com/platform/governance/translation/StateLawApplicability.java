package com.platform.governance.translation;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.policy.Framework;
import com.platform.governance.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a state or city AI law covers an event: the law must be in force
 * on the event's processing date and the AI system must fall under its jurisdiction.
 * Frameworks that are not state laws always apply.
 */
@Slf4j
@Component
public class StateLawApplicability {
    
    private static final Set<String> CALIFORNIA = Set.of("california", "ca");
    private static final Set<String> NEW_YORK = Set.of("new york", "ny", "nyc");
    
    private static final Set<String> HIGH_RISK_DEPARTMENTS = Set.of(
        "imaging", "pathology", "emergency", "surgery", "intensive care", "cardiology");
    
    private final Map<Framework, GovernanceProperties.StateLaw> laws;
    private final Map<String, GovernanceProperties.AiSystem> aiSystems;
    
    public StateLawApplicability(GovernanceProperties properties) {
        this.laws = properties.getStateLaws();
        this.aiSystems = properties.getAiSystems();
    }
    
    public boolean applies(Framework framework, TelemetryEvent event) {
        if (!framework.isStateLaw()) {
            return true;
        }
        if (!inForce(framework, event)) {
            return false;
        }
        GovernanceProperties.AiSystem system = aiSystems.get(event.getAiSystemId());
        if (system == null) {
            log.debug("AI system {} has no deployment context, {} not applied", event.getAiSystemId(), framework);
            return false;
        }
        return switch (framework) {
            case CA_SB1047 -> in(system.getLocation(), CALIFORNIA)
                && (system.isHighRisk() || in(system.getDepartment(), HIGH_RISK_DEPARTMENTS));
            case NYC_LL144 -> in(system.getLocation(), NEW_YORK) && isEmploymentTool(system);
            default -> false;
        };
    }
    
    boolean inForce(Framework framework, TelemetryEvent event) {
        GovernanceProperties.StateLaw law = laws.get(framework);
        if (law == null || law.getEffectiveDate() == null || event.getProcessedAt() == null) {
            return false;
        }
        LocalDate day = LocalDate.ofInstant(event.getProcessedAt(), ZoneOffset.UTC);
        return !day.isBefore(law.getEffectiveDate())
            && (law.getSunsetDate() == null || !day.isAfter(law.getSunsetDate()));
    }
    
    private static boolean isEmploymentTool(GovernanceProperties.AiSystem system) {
        if (system.isEmploymentAi() || "hr".equalsIgnoreCase(trimmed(system.getDepartment()))) {
            return true;
        }
        String name = system.getName() != null ? system.getName().toLowerCase(Locale.ROOT) : "";
        return name.contains("hiring") || name.contains("recruitment");
    }
    
    private static boolean in(String value, Set<String> accepted) {
        return value != null && accepted.contains(trimmed(value).toLowerCase(Locale.ROOT));
    }
    
    private static String trimmed(String value) {
        return value != null ? value.trim() : null;
    }
}
