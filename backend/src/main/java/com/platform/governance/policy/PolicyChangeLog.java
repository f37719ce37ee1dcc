package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.governance.telemetry.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit entry written in the same step that activates a policy version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyChangeLog {
    
    private String id;
    
    private String policyVersionId;
    
    private EventType eventType;
    
    private Framework framework;
    
    private ChangeType changeType;
    
    /**
     * Version that was active before this change, null for the first version.
     */
    private String previousVersion;
    
    private String newVersion;
    
    private String changeReason;
    
    private String changedBy;
    
    private Instant changedAt;
    
    public enum ChangeType {
        CREATED("created"),
        ROLLED_BACK("rolled_back");
        
        private final String value;
        
        ChangeType(String value) {
            this.value = value;
        }
        
        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
