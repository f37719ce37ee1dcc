package com.platform.governance.error;

import com.platform.governance.policy.PolicyKey;

/**
 * A policy or policy version the caller asked for explicitly does not exist.
 * Translation never raises this: a key without policy just yields no violations.
 */
public class ResourceNotFoundException extends GovernanceException {
    
    private final PolicyKey policyKey;
    private final String version;
    
    private ResourceNotFoundException(ErrorCode errorCode, PolicyKey policyKey, String version, String message) {
        super(errorCode, message);
        this.policyKey = policyKey;
        this.version = version;
    }
    
    public static ResourceNotFoundException noActivePolicy(PolicyKey key) {
        return new ResourceNotFoundException(ErrorCode.POLICY_NOT_FOUND, key, null,
            "No active policy for " + key);
    }
    
    public static ResourceNotFoundException versionNotFound(PolicyKey key, String version) {
        return new ResourceNotFoundException(ErrorCode.POLICY_VERSION_NOT_FOUND, key, version,
            "Policy " + key + " has no version " + version);
    }
    
    public PolicyKey getPolicyKey() {
        return policyKey;
    }
    
    /**
     * Null for {@link ErrorCode#POLICY_NOT_FOUND}.
     */
    public String getVersion() {
        return version;
    }
}
