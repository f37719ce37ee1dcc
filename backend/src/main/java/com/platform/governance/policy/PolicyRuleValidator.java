package com.platform.governance.policy;

import com.platform.governance.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of rule logic before it is hashed, encrypted or stored.
 */
@Component
public class PolicyRuleValidator {
    
    public void validate(PolicyRuleLogic ruleLogic, String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            throw ValidationException.missing("createdBy");
        }
        if (ruleLogic == null) {
            throw ValidationException.invalidRuleLogic("ruleLogic", "must not be null");
        }
        List<PolicyRule> rules = ruleLogic.getRules();
        if (rules.isEmpty()) {
            throw ValidationException.invalidRuleLogic("rules", "at least one rule is required");
        }
        
        Set<String> controlIds = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            PolicyRule rule = rules.get(i);
            String path = "rules[" + i + "]";
            if (rule == null) {
                throw ValidationException.invalidRuleLogic(path, "must not be null");
            }
            validateRule(rule, path);
            if (!controlIds.add(rule.getControlId())) {
                throw ValidationException.invalidRuleLogic(path + ".controlId", 
                    "duplicate controlId '" + rule.getControlId() + "'");
            }
        }
    }
    
    private void validateRule(PolicyRule rule, String path) {
        if (rule.getFramework() == null) {
            throw ValidationException.invalidRuleLogic(path + ".framework", "is required");
        }
        requireText(rule.getControlId(), path + ".controlId");
        requireText(rule.getControlName(), path + ".controlName");
        requireText(rule.getViolationType(), path + ".violationType");
        if (rule.getSeverity() == null) {
            throw ValidationException.invalidRuleLogic(path + ".severity", "is required");
        }
        if (rule.isRequiresReporting()
                && (rule.getReportingDeadlineDays() == null || rule.getReportingDeadlineDays() <= 0)) {
            throw ValidationException.invalidRuleLogic(path + ".reportingDeadlineDays", 
                "must be a positive number of days when reporting is required");
        }
        if (rule.getReportingDeadlineDays() != null && rule.getReportingDeadlineDays() < 0) {
            throw ValidationException.invalidRuleLogic(path + ".reportingDeadlineDays", "must not be negative");
        }
        for (String step : rule.getRemediationSteps()) {
            if (step == null || step.isBlank()) {
                throw ValidationException.invalidRuleLogic(path + ".remediationSteps", "steps must not be blank");
            }
        }
        if (rule.getThresholdLogic() != null) {
            validateCondition(rule.getThresholdLogic(), path + ".thresholdLogic");
        }
    }
    
    private void validateCondition(ThresholdCondition condition, String path) {
        if (condition instanceof ThresholdCondition.Compare compare) {
            requireKnownField(compare.field(), path);
            if (compare.operator() == null) {
                throw ValidationException.invalidRuleLogic(path + ".operator", "is required");
            }
            if (compare.value() == null) {
                throw ValidationException.invalidRuleLogic(path + ".value", "is required");
            }
        } else if (condition instanceof ThresholdCondition.ExceedsThreshold exceeds) {
            if (exceeds.byPercent() != null && exceeds.byPercent().signum() < 0) {
                throw ValidationException.invalidRuleLogic(path + ".byPercent", "must not be negative");
            }
        } else if (condition instanceof ThresholdCondition.ConfiguredThreshold configured) {
            requireKnownField(configured.field(), path);
            if (configured.operator() == null) {
                throw ValidationException.invalidRuleLogic(path + ".operator", "is required");
            }
            if (!ThresholdProfiles.isKnown(configured.threshold())) {
                throw ValidationException.invalidRuleLogic(path + ".threshold", 
                    "unknown threshold '" + configured.threshold() + "'");
            }
        } else if (condition instanceof ThresholdCondition.MetricIs metricIs) {
            requireText(metricIs.metric(), path + ".metric");
        } else if (condition instanceof ThresholdCondition.AllOf allOf) {
            validateChildren(allOf.conditions(), path);
        } else if (condition instanceof ThresholdCondition.AnyOf anyOf) {
            validateChildren(anyOf.conditions(), path);
        }
    }
    
    private void validateChildren(List<ThresholdCondition> conditions, String path) {
        if (conditions.isEmpty()) {
            throw ValidationException.invalidRuleLogic(path + ".conditions", "must not be empty");
        }
        for (int i = 0; i < conditions.size(); i++) {
            ThresholdCondition child = conditions.get(i);
            if (child == null) {
                throw ValidationException.invalidRuleLogic(path + ".conditions[" + i + "]", "must not be null");
            }
            validateCondition(child, path + ".conditions[" + i + "]");
        }
    }
    
    private void requireKnownField(String field, String path) {
        boolean knownField = ThresholdCondition.FIELD_METRIC_VALUE.equals(field)
            || ThresholdCondition.FIELD_THRESHOLD.equals(field)
            || (field != null && field.startsWith(ThresholdCondition.PAYLOAD_PREFIX)
                && field.length() > ThresholdCondition.PAYLOAD_PREFIX.length());
        if (!knownField) {
            throw ValidationException.invalidRuleLogic(path + ".field", "unsupported field '" + field + "'");
        }
    }
    
    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ValidationException.invalidRuleLogic(field, "is required");
        }
    }
}
