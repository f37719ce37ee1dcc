package com.platform.governance.persistence;

import com.platform.governance.crypto.AesGcmPolicyCipher;
import com.platform.governance.error.PolicyIntegrityException;
import com.platform.governance.persistence.entity.PolicyVersionEntity;
import com.platform.governance.persistence.repository.PolicyVersionJpaRepository;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyChangeLog;
import com.platform.governance.policy.PolicyHistoryEntry;
import com.platform.governance.policy.PolicyRuleLogic;
import com.platform.governance.policy.PolicyStatus;
import com.platform.governance.policy.PolicyStore;
import com.platform.governance.policy.Severity;
import com.platform.governance.policy.VersionBump;
import com.platform.governance.telemetry.EventType;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static com.platform.governance.GovernanceFixtures.FIXED_CLOCK;
import static com.platform.governance.GovernanceFixtures.logic;
import static com.platform.governance.GovernanceFixtures.policyStore;
import static com.platform.governance.GovernanceFixtures.properties;
import static com.platform.governance.GovernanceFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Policy store over H2 with real AES-GCM encryption.
 */
@DataJpaTest
@Import({JpaPolicyVersionRepository.class, EntityMappers.class})
@DisplayName("JpaPolicyVersionRepository Integration Tests")
class JpaPolicyVersionRepositoryTest {
    
    @Autowired
    private JpaPolicyVersionRepository repository;
    
    @Autowired
    private PolicyVersionJpaRepository versionJpaRepository;
    
    @Autowired
    private EntityManager entityManager;
    
    private PolicyStore store;
    
    @BeforeEach
    void setUp() {
        store = policyStore(repository, new AesGcmPolicyCipher(properties()), FIXED_CLOCK);
    }
    
    private static PolicyRuleLogic driftLogic(Severity severity) {
        return logic(rule(Framework.NIST_AI_RMF, "MEASURE-2.3", severity)
            .requiresReporting(true)
            .reportingDeadlineDays(1)
            .remediationSteps(List.of("Rollback model to previous version"))
            .build());
    }
    
    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }
    
    @Test
    @DisplayName("Should store rule logic encrypted and read it back verified")
    void shouldRoundTripEncryptedPolicy() {
        // Given
        String id = store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MAJOR,
            driftLogic(Severity.CRITICAL), "compliance-team", "Initial policy");
        flushAndClear();
        
        // When
        PolicyVersionEntity stored = versionJpaRepository.findById(id).orElseThrow();
        PolicyRuleLogic active = store.getActivePolicy(EventType.DRIFT, Framework.NIST_AI_RMF).orElseThrow();
        
        // Then
        assertThat(stored.getEncryptedRuleLogic()).doesNotContain("MEASURE-2.3");
        assertThat(stored.getRuleHash()).hasSize(64);
        assertThat(stored.getSemanticVersion()).isEqualTo("1.0.0");
        assertThat(stored.getStatus()).isEqualTo(PolicyStatus.ACTIVE);
        assertThat(active.getRules()).singleElement().satisfies(rule -> {
            assertThat(rule.getControlId()).isEqualTo("MEASURE-2.3");
            assertThat(rule.getSeverity()).isEqualTo(Severity.CRITICAL);
        });
    }
    
    @Test
    @DisplayName("Should deprecate the previous version when a new one is activated")
    void shouldKeepOneActiveVersion() {
        // Given
        store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MINOR,
            driftLogic(Severity.HIGH), "compliance-team", "Initial policy");
        store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MINOR,
            driftLogic(Severity.CRITICAL), "compliance-team", "Raise severity");
        flushAndClear();
        
        // When
        List<PolicyHistoryEntry> history = store.getPolicyHistory(EventType.DRIFT, Framework.NIST_AI_RMF);
        List<PolicyChangeLog> changes = store.getChangeLog(EventType.DRIFT, Framework.NIST_AI_RMF);
        
        // Then
        assertThat(history).extracting(PolicyHistoryEntry::version, PolicyHistoryEntry::status)
            .containsExactly(
                tuple("1.0.0", PolicyStatus.DEPRECATED),
                tuple("1.1.0", PolicyStatus.ACTIVE));
        assertThat(history.get(0).deprecatedDate()).isNotNull();
        assertThat(changes).extracting(PolicyChangeLog::getNewVersion).containsExactly("1.0.0", "1.1.0");
        assertThat(changes.get(1).getPreviousVersion()).isEqualTo("1.0.0");
        assertThat(store.getActivePolicy(EventType.DRIFT, Framework.NIST_AI_RMF).orElseThrow()
            .getRules().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }
    
    @Test
    @DisplayName("Should reject an active version whose stored hash was altered")
    void shouldDetectAlteredHash() {
        // Given
        String id = store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MAJOR,
            driftLogic(Severity.CRITICAL), "compliance-team", "Initial policy");
        flushAndClear();
        PolicyVersionEntity entity = versionJpaRepository.findById(id).orElseThrow();
        entity.setRuleHash("0".repeat(64));
        versionJpaRepository.saveAndFlush(entity);
        entityManager.clear();
        
        // When / Then
        assertThatThrownBy(() -> store.getActivePolicy(EventType.DRIFT, Framework.NIST_AI_RMF))
            .isInstanceOf(PolicyIntegrityException.class);
    }
    
    @Test
    @DisplayName("Should reject an active version whose ciphertext was corrupted")
    void shouldDetectCorruptedCiphertext() {
        // Given
        String id = store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MAJOR,
            driftLogic(Severity.CRITICAL), "compliance-team", "Initial policy");
        flushAndClear();
        PolicyVersionEntity entity = versionJpaRepository.findById(id).orElseThrow();
        String ciphertext = entity.getEncryptedRuleLogic();
        char last = ciphertext.charAt(ciphertext.length() - 5);
        entity.setEncryptedRuleLogic(ciphertext.substring(0, ciphertext.length() - 5) 
            + (last == 'A' ? 'B' : 'A') + ciphertext.substring(ciphertext.length() - 4));
        versionJpaRepository.saveAndFlush(entity);
        entityManager.clear();
        
        // When / Then
        assertThatThrownBy(() -> store.getActivePolicy(EventType.DRIFT, Framework.NIST_AI_RMF))
            .isInstanceOf(PolicyIntegrityException.class);
    }
    
    @Test
    @DisplayName("Should roll back by republishing the target content as a new patch")
    void shouldRollBackAsNewPatch() {
        store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MAJOR,
            driftLogic(Severity.HIGH), "compliance-team", "Initial policy");
        store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.PATCH,
            driftLogic(Severity.CRITICAL), "compliance-team", "Fix wording");
        
        String rollbackId = store.rollbackTo(EventType.DRIFT, Framework.NIST_AI_RMF, "1.0.0", "ciso", null);
        flushAndClear();
        
        assertThat(versionJpaRepository.findById(rollbackId).orElseThrow().getSemanticVersion())
            .isEqualTo("1.0.2");
        assertThat(store.getActivePolicy(EventType.DRIFT, Framework.NIST_AI_RMF).orElseThrow()
            .getRules().get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }
}
