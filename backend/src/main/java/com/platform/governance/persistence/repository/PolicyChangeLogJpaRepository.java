package com.platform.governance.persistence.repository;

import com.platform.governance.persistence.entity.PolicyChangeLogEntity;
import com.platform.governance.policy.Framework;
import com.platform.governance.telemetry.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for policy change log entries.
 */
@Repository
public interface PolicyChangeLogJpaRepository extends JpaRepository<PolicyChangeLogEntity, String> {
    
    List<PolicyChangeLogEntity> findByEventTypeAndFramework(EventType eventType, Framework framework);
}
