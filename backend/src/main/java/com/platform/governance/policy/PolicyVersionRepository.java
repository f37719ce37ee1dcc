package com.platform.governance.policy;

import java.util.List;
import java.util.Optional;

/**
 * Storage for encrypted policy versions and their change log.
 */
public interface PolicyVersionRepository {
    
    Optional<PolicyVersion> findActive(PolicyKey key);
    
    Optional<PolicyVersion> findByVersion(PolicyKey key, SemanticVersion version);
    
    /**
     * All versions of a key, ordered by semantic version ascending.
     */
    List<PolicyVersion> findLineage(PolicyKey key);
    
    /**
     * Deprecates the currently active version of the key (if any), stores the new
     * version as active and appends the change log entry, as one atomic step.
     */
    PolicyVersion activate(PolicyVersion newVersion, PolicyChangeLog changeLog);
    
    /**
     * Change log entries of a key, oldest first.
     */
    List<PolicyChangeLog> findChangeLog(PolicyKey key);
}
