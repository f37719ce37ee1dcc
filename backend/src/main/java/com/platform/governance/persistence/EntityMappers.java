package com.platform.governance.persistence;

import com.platform.governance.persistence.entity.PolicyChangeLogEntity;
import com.platform.governance.persistence.entity.PolicyVersionEntity;
import com.platform.governance.policy.PolicyChangeLog;
import com.platform.governance.policy.PolicyVersion;
import com.platform.governance.policy.SemanticVersion;
import org.springframework.stereotype.Component;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 */
@Component
public class EntityMappers {
    
    // ==================== PolicyVersion ====================
    
    public PolicyVersionEntity toEntity(PolicyVersion domain) {
        return PolicyVersionEntity.builder()
            .id(domain.getId())
            .eventType(domain.getEventType())
            .framework(domain.getFramework())
            .semanticVersion(domain.getVersion().toString())
            .encryptedRuleLogic(domain.getEncryptedRuleLogic())
            .ruleHash(domain.getRuleHash())
            .status(domain.getStatus())
            .effectiveDate(domain.getEffectiveDate())
            .deprecatedDate(domain.getDeprecatedDate())
            .createdBy(domain.getCreatedBy())
            .createdAt(domain.getCreatedAt())
            .build();
    }
    
    public PolicyVersion toDomain(PolicyVersionEntity entity) {
        return PolicyVersion.builder()
            .id(entity.getId())
            .eventType(entity.getEventType())
            .framework(entity.getFramework())
            .version(SemanticVersion.parse(entity.getSemanticVersion()))
            .encryptedRuleLogic(entity.getEncryptedRuleLogic())
            .ruleHash(entity.getRuleHash())
            .status(entity.getStatus())
            .effectiveDate(entity.getEffectiveDate())
            .deprecatedDate(entity.getDeprecatedDate())
            .createdBy(entity.getCreatedBy())
            .createdAt(entity.getCreatedAt())
            .build();
    }
    
    // ==================== PolicyChangeLog ====================
    
    public PolicyChangeLogEntity toEntity(PolicyChangeLog domain) {
        return PolicyChangeLogEntity.builder()
            .id(domain.getId())
            .policyVersionId(domain.getPolicyVersionId())
            .eventType(domain.getEventType())
            .framework(domain.getFramework())
            .changeType(domain.getChangeType())
            .previousVersion(domain.getPreviousVersion())
            .newVersion(domain.getNewVersion())
            .changeReason(domain.getChangeReason())
            .changedBy(domain.getChangedBy())
            .changedAt(domain.getChangedAt())
            .build();
    }
    
    public PolicyChangeLog toDomain(PolicyChangeLogEntity entity) {
        return PolicyChangeLog.builder()
            .id(entity.getId())
            .policyVersionId(entity.getPolicyVersionId())
            .eventType(entity.getEventType())
            .framework(entity.getFramework())
            .changeType(entity.getChangeType())
            .previousVersion(entity.getPreviousVersion())
            .newVersion(entity.getNewVersion())
            .changeReason(entity.getChangeReason())
            .changedBy(entity.getChangedBy())
            .changedAt(entity.getChangedAt())
            .build();
    }
}
