package com.platform.governance.policy;

import com.platform.governance.telemetry.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored, encrypted policy version for one (eventType, framework) key.
 * Rule content is only held in encrypted form.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyVersion {
    
    private String id;
    
    private EventType eventType;
    
    private Framework framework;
    
    private SemanticVersion version;
    
    /**
     * Base64 of IV followed by ciphertext and authentication tag.
     */
    private String encryptedRuleLogic;
    
    /**
     * SHA-256 hex of the canonical plaintext.
     */
    private String ruleHash;
    
    private PolicyStatus status;
    
    private Instant effectiveDate;
    
    private Instant deprecatedDate;
    
    private String createdBy;
    
    private Instant createdAt;
    
    public PolicyKey key() {
        return PolicyKey.of(eventType, framework);
    }
    
    public boolean isActive() {
        return status == PolicyStatus.ACTIVE;
    }
    
    /**
     * Moves this version from active to deprecated. Status never moves back.
     */
    public void deprecate(Instant at) {
        if (status != PolicyStatus.ACTIVE) {
            throw new IllegalStateException("Only an active policy version can be deprecated: " + id);
        }
        this.status = PolicyStatus.DEPRECATED;
        this.deprecatedDate = at;
    }
}
