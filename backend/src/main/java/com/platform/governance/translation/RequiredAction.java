package com.platform.governance.translation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A remediation task owned by exactly one violation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RequiredAction {
    
    String id;
    
    String violationId;
    
    String aiSystemId;
    
    ActionType actionType;
    
    ActionPriority priority;
    
    String description;
    
    /**
     * Null for automated actions.
     */
    Assignee assignee;
    
    /**
     * Null means best effort.
     */
    Instant deadline;
    
    boolean automated;
    
    ActionDetails actionDetails;
    
    @Builder.Default
    ActionStatus status = ActionStatus.PENDING;
}
