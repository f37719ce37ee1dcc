package com.platform.governance.policy;

import java.time.Instant;

/**
 * Version metadata returned by history queries. Never carries rule content.
 */
public record PolicyHistoryEntry(
    String id,
    String version,
    PolicyStatus status,
    Instant effectiveDate,
    Instant deprecatedDate,
    String ruleHash,
    String createdBy
) {
    
    public static PolicyHistoryEntry from(PolicyVersion version) {
        return new PolicyHistoryEntry(
            version.getId(),
            version.getVersion().toString(),
            version.getStatus(),
            version.getEffectiveDate(),
            version.getDeprecatedDate(),
            version.getRuleHash(),
            version.getCreatedBy());
    }
}
