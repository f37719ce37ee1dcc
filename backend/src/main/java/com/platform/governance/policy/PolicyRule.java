package com.platform.governance.policy;

import com.platform.governance.telemetry.TelemetryEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single regulatory control mapping inside a policy version.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PolicyRule {
    
    Framework framework;
    
    /**
     * Control identifier within the framework (e.g. "164.402", "MANAGE-4.1").
     */
    String controlId;
    
    String controlName;
    
    String violationType;
    
    Severity severity;
    
    boolean requiresReporting;
    
    /**
     * Days allowed for regulatory reporting. Required when reporting is required.
     */
    Integer reportingDeadlineDays;
    
    /**
     * Optional condition. When absent the rule matches every event of its key.
     */
    ThresholdCondition thresholdLogic;
    
    @Builder.Default
    List<String> remediationSteps = List.of();
    
    public List<String> getRemediationSteps() {
        return remediationSteps != null ? remediationSteps : List.of();
    }
    
    public boolean matches(TelemetryEvent event, ThresholdLookup thresholds) {
        return thresholdLogic == null || thresholdLogic.evaluate(event, thresholds);
    }
}
