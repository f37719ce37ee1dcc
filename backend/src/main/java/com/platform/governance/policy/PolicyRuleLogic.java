package com.platform.governance.policy;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Decrypted content of a policy version: the rules plus authoring metadata.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PolicyRuleLogic {
    
    @Builder.Default
    List<PolicyRule> rules = List.of();
    
    Metadata metadata;
    
    public List<PolicyRule> getRules() {
        return rules != null ? rules : List.of();
    }
    
    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Metadata {
        String author;
        String reviewedBy;
        String changeReason;
        Instant lastUpdated;
    }
}
