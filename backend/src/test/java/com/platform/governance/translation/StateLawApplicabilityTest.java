package com.platform.governance.translation;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.policy.Framework;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.telemetry.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static com.platform.governance.GovernanceFixtures.event;
import static com.platform.governance.GovernanceFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StateLawApplicability")
class StateLawApplicabilityTest {
    
    private GovernanceProperties properties;
    
    @BeforeEach
    void setUp() {
        properties = properties();
        properties.getAiSystems().put("sys-ca-imaging", system("Chest X-ray Triage", "Imaging", "California", false, false));
        properties.getAiSystems().put("sys-ca-billing", system("Claims Coder", "Billing", "CA", false, false));
        properties.getAiSystems().put("sys-ny-recruit", system("Nurse Recruitment Ranker", "Nursing", "new york", false, false));
        properties.getAiSystems().put("sys-tx-hiring", system("Hiring Screener", "HR", "Texas", false, true));
    }
    
    private static GovernanceProperties.AiSystem system(String name, String department, String location,
            boolean highRisk, boolean employmentAi) {
        GovernanceProperties.AiSystem system = new GovernanceProperties.AiSystem();
        system.setName(name);
        system.setDepartment(department);
        system.setLocation(location);
        system.setHighRisk(highRisk);
        system.setEmploymentAi(employmentAi);
        return system;
    }
    
    private static TelemetryEvent eventFrom(String aiSystemId) {
        return event(EventType.PHI_EXPOSURE).aiSystemId(aiSystemId).build();
    }
    
    @Test
    @DisplayName("Should always apply frameworks that are not state laws")
    void shouldApplyNonStateFrameworks() {
        StateLawApplicability applicability = new StateLawApplicability(properties);
        
        assertThat(applicability.applies(Framework.HIPAA, eventFrom("unknown-system"))).isTrue();
        assertThat(applicability.applies(Framework.NIST_AI_RMF, event(EventType.DRIFT).processedAt(null).build()))
            .isTrue();
    }
    
    @Nested
    @DisplayName("CA SB 1047")
    class California {
        
        @Test
        @DisplayName("Should cover high-risk departments deployed in California")
        void shouldCoverHighRiskCaliforniaSystems() {
            StateLawApplicability applicability = new StateLawApplicability(properties);
            
            assertThat(applicability.applies(Framework.CA_SB1047, eventFrom("sys-ca-imaging"))).isTrue();
            assertThat(applicability.applies(Framework.CA_SB1047, eventFrom("sys-ca-billing"))).isFalse();
            assertThat(applicability.applies(Framework.CA_SB1047, eventFrom("sys-ny-recruit"))).isFalse();
        }
        
        @Test
        @DisplayName("Should cover systems flagged high risk regardless of department")
        void shouldCoverFlaggedHighRisk() {
            properties.getAiSystems().get("sys-ca-billing").setHighRisk(true);
            
            assertThat(new StateLawApplicability(properties).applies(Framework.CA_SB1047, eventFrom("sys-ca-billing")))
                .isTrue();
        }
    }
    
    @Nested
    @DisplayName("NYC Local Law 144")
    class NewYorkCity {
        
        @Test
        @DisplayName("Should cover employment tools deployed in New York only")
        void shouldCoverNewYorkEmploymentTools() {
            StateLawApplicability applicability = new StateLawApplicability(properties);
            
            assertThat(applicability.applies(Framework.NYC_LL144, eventFrom("sys-ny-recruit"))).isTrue();
            assertThat(applicability.applies(Framework.NYC_LL144, eventFrom("sys-tx-hiring"))).isFalse();
            assertThat(applicability.applies(Framework.NYC_LL144, eventFrom("sys-ca-imaging"))).isFalse();
        }
    }
    
    @Test
    @DisplayName("Should not apply a law before its effective date or after its sunset")
    void shouldRespectInForceWindow() {
        // Given CA SB 1047 in force from 2024-01-01 until a sunset on 2025-06-30
        properties.getStateLaws().put(Framework.CA_SB1047,
            new GovernanceProperties.StateLaw(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 6, 30)));
        StateLawApplicability applicability = new StateLawApplicability(properties);
        TelemetryEvent base = eventFrom("sys-ca-imaging");
        
        // Then
        assertThat(applicability.applies(Framework.CA_SB1047,
            base.toBuilder().processedAt(Instant.parse("2023-12-31T23:59:59Z")).build())).isFalse();
        assertThat(applicability.applies(Framework.CA_SB1047,
            base.toBuilder().processedAt(Instant.parse("2024-01-01T00:00:00Z")).build())).isTrue();
        assertThat(applicability.applies(Framework.CA_SB1047,
            base.toBuilder().processedAt(Instant.parse("2025-06-30T18:00:00Z")).build())).isTrue();
        assertThat(applicability.applies(Framework.CA_SB1047,
            base.toBuilder().processedAt(Instant.parse("2025-07-01T00:00:00Z")).build())).isFalse();
    }
    
    @Test
    @DisplayName("Should not apply a law without a configured window, system context or event time")
    void shouldFailClosedOnMissingContext() {
        StateLawApplicability applicability = new StateLawApplicability(properties);
        
        assertThat(applicability.applies(Framework.CA_SB1047, eventFrom("unregistered"))).isFalse();
        assertThat(applicability.applies(Framework.CA_SB1047,
            eventFrom("sys-ca-imaging").toBuilder().processedAt(null).build())).isFalse();
        
        properties.getStateLaws().remove(Framework.NYC_LL144);
        assertThat(new StateLawApplicability(properties).applies(Framework.NYC_LL144, eventFrom("sys-ny-recruit")))
            .isFalse();
    }
}
