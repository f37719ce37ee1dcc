package com.platform.governance.policy;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named compliance thresholds with per-organization overrides.
 *
 * Rules reference thresholds by name through {@link ThresholdCondition.ConfiguredThreshold};
 * an organization's overrides replace individual defaults and leave the rest in place.
 * Overrides are checked against each threshold's allowed range at startup.
 */
@Slf4j
@Component
public class ThresholdProfiles {

    private static final String OVERRIDE_PATH = "governance.thresholds.organizations";

    private static final Map<String, Setting> SETTINGS = settings();

    private final Map<String, BigDecimal> defaults;
    private final Map<String, Map<String, BigDecimal>> byOrganization;

    public ThresholdProfiles(GovernanceProperties properties) {
        Map<String, BigDecimal> base = new HashMap<>();
        SETTINGS.forEach((name, setting) -> base.put(normalize(name), setting.defaultValue()));
        this.defaults = Collections.unmodifiableMap(base);

        Map<String, Map<String, BigDecimal>> merged = new HashMap<>();
        properties.getThresholds().getOrganizations().forEach((organizationId, overrides) -> {
            Map<String, BigDecimal> profile = new HashMap<>(base);
            overrides.forEach((name, value) -> profile.put(normalize(name), checked(organizationId, name, value)));
            merged.put(organizationId, Collections.unmodifiableMap(profile));
            log.info("Loaded {} threshold override(s) for organization {}", overrides.size(), organizationId);
        });
        this.byOrganization = Collections.unmodifiableMap(merged);
    }

    /**
     * Thresholds in effect for the organization; the defaults when it has no overrides
     * or the id is null.
     */
    public ThresholdLookup forOrganization(String organizationId) {
        Map<String, BigDecimal> profile = organizationId != null
            ? byOrganization.getOrDefault(organizationId, defaults)
            : defaults;
        return name -> name == null ? Optional.empty() : Optional.ofNullable(profile.get(normalize(name)));
    }

    public static boolean isKnown(String name) {
        return name != null && SETTINGS.keySet().stream().anyMatch(known -> normalize(known).equals(normalize(name)));
    }

    private static BigDecimal checked(String organizationId, String name, BigDecimal value) {
        String path = OVERRIDE_PATH + "." + organizationId + "." + name;
        Setting setting = SETTINGS.entrySet().stream()
            .filter(entry -> normalize(entry.getKey()).equals(normalize(name)))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElseThrow(() -> ValidationException.invalidValue(path, name, "unknown threshold"));
        if (value == null) {
            throw ValidationException.missing(path);
        }
        if (value.compareTo(setting.min()) < 0 || value.compareTo(setting.max()) > 0) {
            throw ValidationException.invalidValue(path, value,
                "must be between " + setting.min().toPlainString() + " and " + setting.max().toPlainString());
        }
        return value;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Setting> settings() {
        Map<String, Setting> settings = new LinkedHashMap<>();
        // Fractions: 0.10 is a 10% accuracy drop, variance or error rate
        settings.put("drift.accuracyDropMedium", Setting.of("0.05", "0.01", "0.5"));
        settings.put("drift.accuracyDropHigh", Setting.of("0.10", "0.01", "0.5"));
        settings.put("drift.accuracyDropFDA", Setting.of("0.10", "0.01", "0.5"));
        settings.put("bias.varianceMedium", Setting.of("0.05", "0.01", "0.5"));
        settings.put("bias.varianceHigh", Setting.of("0.10", "0.01", "0.5"));
        settings.put("bias.varianceNYC", Setting.of("0.04", "0.01", "0.5"));
        settings.put("latency.increaseMedium", Setting.of("0.15", "0.01", "2.0"));
        settings.put("latency.increaseHigh", Setting.of("0.30", "0.01", "2.0"));
        settings.put("error.rateMedium", Setting.of("0.01", "0.001", "0.5"));
        settings.put("error.rateHigh", Setting.of("0.05", "0.001", "0.5"));
        settings.put("error.rateFDA", Setting.of("0.02", "0.001", "0.5"));
        return Collections.unmodifiableMap(settings);
    }

    private record Setting(BigDecimal defaultValue, BigDecimal min, BigDecimal max) {

        static Setting of(String defaultValue, String min, String max) {
            return new Setting(new BigDecimal(defaultValue), new BigDecimal(min), new BigDecimal(max));
        }
    }
}
