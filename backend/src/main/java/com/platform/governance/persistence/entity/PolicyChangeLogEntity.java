package com.platform.governance.persistence.entity;

import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyChangeLog.ChangeType;
import com.platform.governance.telemetry.EventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the append-only policy change log.
 */
@Entity
@Table(name = "policy_change_log", indexes = {
    @Index(name = "idx_change_log_key", columnList = "event_type, framework, changed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyChangeLogEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "policy_version_id", length = 36, nullable = false, updatable = false)
    private String policyVersionId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", columnDefinition = "VARCHAR(50)", nullable = false, updatable = false)
    private EventType eventType;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "framework", columnDefinition = "VARCHAR(30)", nullable = false, updatable = false)
    private Framework framework;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", columnDefinition = "VARCHAR(20)", nullable = false, updatable = false)
    private ChangeType changeType;
    
    @Column(name = "previous_version", length = 32, updatable = false)
    private String previousVersion;
    
    @Column(name = "new_version", length = 32, nullable = false, updatable = false)
    private String newVersion;
    
    @Column(name = "change_reason", columnDefinition = "TEXT", updatable = false)
    private String changeReason;
    
    @Column(name = "changed_by", nullable = false, updatable = false)
    private String changedBy;
    
    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;
}
