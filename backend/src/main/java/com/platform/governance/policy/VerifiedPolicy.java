package com.platform.governance.policy;

/**
 * Decrypted rule logic whose hash has been checked, with the version it came from.
 */
public record VerifiedPolicy(String policyVersionId, PolicyKey key, SemanticVersion version, PolicyRuleLogic ruleLogic) {
}
