package com.platform.governance.translation;

import com.platform.governance.policy.Framework;
import com.platform.governance.policy.Severity;
import com.platform.governance.telemetry.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.platform.governance.GovernanceFixtures.driftEvent;
import static com.platform.governance.GovernanceFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RiskAssessor")
class RiskAssessorTest {
    
    private final RiskAssessor assessor = new RiskAssessor();
    
    private static ComplianceViolation violation(Framework framework, String controlId, Severity severity) {
        return ComplianceViolation.builder()
            .id(controlId)
            .framework(framework)
            .controlId(controlId)
            .severity(severity)
            .build();
    }
    
    @Test
    @DisplayName("Should weight severities and escalate reportable PHI breaches to the privacy officer")
    void shouldAssessPhiBreach() {
        List<ComplianceViolation> violations = List.of(
            violation(Framework.HIPAA, "164.402", Severity.CRITICAL).toBuilder().requiresReporting(true).build(),
            violation(Framework.HIPAA, "164.312(a)", Severity.HIGH));
        
        RiskAssessment risk = assessor.assess(event(EventType.PHI_EXPOSURE).build(), violations);
        
        assertThat(risk.score()).isEqualTo(15);
        assertThat(risk.level()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(risk.factors()).containsExactly(
            "1 critical violation(s)", "1 high-severity violation(s)", 
            "PHI breach detected", "Regulatory reporting required");
        assertThat(risk.escalationRequired()).isTrue();
        assertThat(risk.escalationPath()).containsExactly("Privacy Officer", "CISO", "Chief Compliance Officer", "Board");
    }
    
    @Test
    @DisplayName("Should escalate two high violations through the clinical path for FDA")
    void shouldEscalateFdaViolations() {
        List<ComplianceViolation> violations = List.of(
            violation(Framework.FDA_SAMD, "FDA-PCCP-2", Severity.HIGH),
            violation(Framework.NIST_AI_RMF, "MANAGE-4.1", Severity.HIGH));
        
        RiskAssessment risk = assessor.assess(driftEvent(), violations);
        
        assertThat(risk.score()).isEqualTo(10);
        assertThat(risk.escalationRequired()).isTrue();
        assertThat(risk.escalationPath()).containsExactly("Chief Compliance Officer", "CISO", "Clinical Owner", "Board");
    }
    
    @Test
    @DisplayName("Should not escalate a single medium violation")
    void shouldNotEscalateMedium() {
        RiskAssessment risk = assessor.assess(driftEvent(), 
            List.of(violation(Framework.NIST_AI_RMF, "MEASURE-2.1", Severity.MEDIUM)));
        
        assertThat(risk.score()).isEqualTo(2);
        assertThat(risk.level()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(risk.factors()).isEmpty();
        assertThat(risk.escalationRequired()).isFalse();
        assertThat(risk.escalationPath()).isEmpty();
    }
    
    @ParameterizedTest
    @CsvSource({"0, LOW", "1, LOW", "2, MEDIUM", "4, MEDIUM", "5, HIGH", "9, HIGH", "10, CRITICAL", "42, CRITICAL"})
    @DisplayName("Should map scores to levels")
    void shouldMapScoreToLevel(int score, RiskLevel expected) {
        assertThat(RiskLevel.fromScore(score)).isEqualTo(expected);
    }
}
