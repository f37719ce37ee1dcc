package com.platform.governance.policy;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.error.ErrorCode;
import com.platform.governance.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static com.platform.governance.GovernanceFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ThresholdProfiles")
class ThresholdProfilesTest {
    
    private static GovernanceProperties withOverrides(String organizationId, Map<String, BigDecimal> overrides) {
        GovernanceProperties properties = properties();
        properties.getThresholds().getOrganizations().put(organizationId, overrides);
        return properties;
    }
    
    @Test
    @DisplayName("Should resolve defaults for organizations without overrides")
    void shouldResolveDefaults() {
        ThresholdProfiles profiles = new ThresholdProfiles(properties());
        
        assertThat(profiles.forOrganization(null).resolve("drift.accuracyDropHigh")).contains(new BigDecimal("0.10"));
        assertThat(profiles.forOrganization("hs-unknown").resolve("error.rateFDA")).contains(new BigDecimal("0.02"));
        assertThat(profiles.forOrganization(null).resolve("drift.unknown")).isEmpty();
    }
    
    @Test
    @DisplayName("Should replace only the overridden thresholds")
    void shouldMergeOverridesWithDefaults() {
        ThresholdProfiles profiles = new ThresholdProfiles(
            withOverrides("hs-northwind", Map.of("drift.accuracydrophigh", new BigDecimal("0.08"))));
        
        ThresholdLookup northwind = profiles.forOrganization("hs-northwind");
        
        assertThat(northwind.resolve("drift.accuracyDropHigh")).contains(new BigDecimal("0.08"));
        assertThat(northwind.resolve("drift.accuracyDropMedium")).contains(new BigDecimal("0.05"));
        assertThat(profiles.forOrganization("hs-other").resolve("drift.accuracyDropHigh"))
            .contains(new BigDecimal("0.10"));
    }
    
    @Test
    @DisplayName("Should reject overrides outside the allowed range")
    void shouldRejectOutOfRangeOverride() {
        GovernanceProperties properties = withOverrides("hs-lax", Map.of("latency.increaseHigh", new BigDecimal("2.5")));
        
        assertThatThrownBy(() -> new ThresholdProfiles(properties))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("must be between 0.01 and 2.0")
            .satisfies(e -> assertThat(((ValidationException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_FIELD_VALUE));
    }
    
    @Test
    @DisplayName("Should reject overrides of unknown thresholds")
    void shouldRejectUnknownOverride() {
        GovernanceProperties properties = withOverrides("hs-typo", Map.of("drift.accuracyDrop", new BigDecimal("0.1")));
        
        assertThatThrownBy(() -> new ThresholdProfiles(properties))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("unknown threshold");
    }
}
