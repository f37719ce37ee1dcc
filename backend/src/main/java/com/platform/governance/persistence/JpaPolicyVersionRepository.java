package com.platform.governance.persistence;

import com.platform.governance.persistence.entity.PolicyVersionEntity;
import com.platform.governance.persistence.repository.PolicyChangeLogJpaRepository;
import com.platform.governance.persistence.repository.PolicyVersionJpaRepository;
import com.platform.governance.policy.PolicyChangeLog;
import com.platform.governance.policy.PolicyKey;
import com.platform.governance.policy.PolicyStatus;
import com.platform.governance.policy.PolicyVersion;
import com.platform.governance.policy.PolicyVersionRepository;
import com.platform.governance.policy.SemanticVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Policy version repository backed by JPA.
 * Activation runs in one transaction with the key's active row locked.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "governance.policy.store", havingValue = "jpa", matchIfMissing = true)
public class JpaPolicyVersionRepository implements PolicyVersionRepository {
    
    private final PolicyVersionJpaRepository versionRepository;
    private final PolicyChangeLogJpaRepository changeLogRepository;
    private final EntityMappers entityMappers;
    
    public JpaPolicyVersionRepository(
            PolicyVersionJpaRepository versionRepository,
            PolicyChangeLogJpaRepository changeLogRepository,
            EntityMappers entityMappers) {
        this.versionRepository = versionRepository;
        this.changeLogRepository = changeLogRepository;
        this.entityMappers = entityMappers;
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<PolicyVersion> findActive(PolicyKey key) {
        return versionRepository.findByEventTypeAndFrameworkAndStatus(
                key.eventType(), key.framework(), PolicyStatus.ACTIVE)
            .map(entityMappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<PolicyVersion> findByVersion(PolicyKey key, SemanticVersion version) {
        return versionRepository.findByEventTypeAndFrameworkAndSemanticVersion(
                key.eventType(), key.framework(), version.toString())
            .map(entityMappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<PolicyVersion> findLineage(PolicyKey key) {
        return versionRepository.findByEventTypeAndFramework(key.eventType(), key.framework()).stream()
            .map(entityMappers::toDomain)
            .sorted(Comparator.comparing(PolicyVersion::getVersion))
            .toList();
    }
    
    @Override
    @Transactional
    public PolicyVersion activate(PolicyVersion newVersion, PolicyChangeLog changeLog) {
        PolicyKey key = newVersion.key();
        List<PolicyVersionEntity> active = versionRepository.findForUpdate(
            key.eventType(), key.framework(), PolicyStatus.ACTIVE);
        for (PolicyVersionEntity entity : active) {
            entity.setStatus(PolicyStatus.DEPRECATED);
            entity.setDeprecatedDate(newVersion.getEffectiveDate());
            log.debug("Deprecating policy version {} for {}", entity.getSemanticVersion(), key);
        }
        versionRepository.saveAllAndFlush(active);
        
        PolicyVersionEntity saved = versionRepository.save(entityMappers.toEntity(newVersion));
        changeLogRepository.save(entityMappers.toEntity(changeLog));
        return entityMappers.toDomain(saved);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<PolicyChangeLog> findChangeLog(PolicyKey key) {
        return changeLogRepository.findByEventTypeAndFramework(key.eventType(), key.framework()).stream()
            .map(entityMappers::toDomain)
            .sorted(Comparator.comparing(PolicyChangeLog::getChangedAt)
                .thenComparing(entry -> SemanticVersion.parse(entry.getNewVersion())))
            .toList();
    }
}
