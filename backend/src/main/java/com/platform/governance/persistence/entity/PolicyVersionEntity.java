package com.platform.governance.persistence.entity;

import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyStatus;
import com.platform.governance.telemetry.EventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for policy versions.
 * Rule content is only ever persisted encrypted.
 */
@Entity
@Table(name = "policy_versions", 
    uniqueConstraints = @UniqueConstraint(name = "uk_policy_version", 
        columnNames = {"event_type", "framework", "semantic_version"}),
    indexes = {
        @Index(name = "idx_policy_version_key_status", columnList = "event_type, framework, status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyVersionEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", columnDefinition = "VARCHAR(50)", nullable = false)
    private EventType eventType;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "framework", columnDefinition = "VARCHAR(30)", nullable = false)
    private Framework framework;
    
    @Column(name = "semantic_version", length = 32, nullable = false)
    private String semanticVersion;
    
    @Column(name = "encrypted_rule_logic", columnDefinition = "TEXT", nullable = false)
    private String encryptedRuleLogic;
    
    @Column(name = "rule_hash", length = 64, nullable = false)
    private String ruleHash;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private PolicyStatus status;
    
    @Column(name = "effective_date", nullable = false)
    private Instant effectiveDate;
    
    @Column(name = "deprecated_date")
    private Instant deprecatedDate;
    
    @Column(name = "created_by", nullable = false)
    private String createdBy;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    /**
     * Optimistic locking version for concurrent update safety.
     */
    @Version
    @Column(name = "lock_version", nullable = false)
    private Long lockVersion;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (lockVersion == null) {
            lockVersion = 0L;
        }
    }
}
