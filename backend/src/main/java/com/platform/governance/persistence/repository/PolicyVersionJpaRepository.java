package com.platform.governance.persistence.repository;

import com.platform.governance.persistence.entity.PolicyVersionEntity;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyStatus;
import com.platform.governance.telemetry.EventType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for policy versions.
 */
@Repository
public interface PolicyVersionJpaRepository extends JpaRepository<PolicyVersionEntity, String> {
    
    Optional<PolicyVersionEntity> findByEventTypeAndFrameworkAndStatus(
        EventType eventType, Framework framework, PolicyStatus status);
    
    /**
     * Active versions of a key, row-locked for the activation transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PolicyVersionEntity p WHERE p.eventType = :eventType AND p.framework = :framework AND p.status = :status")
    List<PolicyVersionEntity> findForUpdate(
        @Param("eventType") EventType eventType, 
        @Param("framework") Framework framework, 
        @Param("status") PolicyStatus status);
    
    Optional<PolicyVersionEntity> findByEventTypeAndFrameworkAndSemanticVersion(
        EventType eventType, Framework framework, String semanticVersion);
    
    List<PolicyVersionEntity> findByEventTypeAndFramework(EventType eventType, Framework framework);
}
