package com.platform.governance.translation;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.Severity;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Plans the required actions of a single violation. Produces the plan only;
 * nothing is enqueued or executed.
 * 
 * The time basis is the violation's detection time, so the same violation always
 * yields the same plan.
 */
@Component
public class ActionPlanner {
    
    private static final List<String> ALERT_CHANNELS = List.of("email", "sms", "dashboard");
    
    private static final Comparator<RequiredAction> BY_PRIORITY_THEN_DEADLINE = Comparator
        .comparing(RequiredAction::getPriority)
        .thenComparing(RequiredAction::getDeadline, Comparator.nullsLast(Comparator.naturalOrder()));
    
    private final GovernanceProperties.Planner config;
    private final Set<ActionType> automationHooks;
    
    public ActionPlanner(GovernanceProperties properties) {
        this.config = properties.getPlanner();
        this.automationHooks = config.getAutomationHooks().isEmpty() 
            ? EnumSet.noneOf(ActionType.class) 
            : EnumSet.copyOf(config.getAutomationHooks());
    }
    
    public List<RequiredAction> planActions(ComplianceViolation violation) {
        Instant basis = violation.getDetectedAt();
        Severity severity = violation.getSeverity();
        List<RequiredAction.RequiredActionBuilder> drafts = new ArrayList<>();
        
        if (severity == Severity.CRITICAL) {
            planCriticalResponse(violation, basis, drafts);
        }
        
        if (violation.isRequiresReporting() && violation.getReportingDeadline() != null) {
            drafts.add(draft(violation)
                .actionType(ActionType.NOTIFY)
                .priority(priorityFor(severity))
                .description(String.format("File regulatory report for %s %s (%s) by %s", 
                    violation.getFramework().getValue(), violation.getControlId(), 
                    violation.getControlName(), violation.getReportingDeadline()))
                .assignee(reportingOwner(violation.getFramework()))
                .deadline(violation.getReportingDeadline())
                .automated(false)
                .actionDetails(new ActionDetails.RegulatoryReport(
                    violation.getFramework(), violation.getControlId(), violation.getReportingDeadline())));
        }
        
        List<String> steps = violation.getRemediationSteps();
        for (int i = 0; i < steps.size(); i++) {
            String step = steps.get(i).trim();
            ActionType type = inferActionType(step);
            drafts.add(draft(violation)
                .actionType(type)
                .priority(priorityFor(severity))
                .description(step)
                .assignee(assigneeFor(type, violation.getFramework()))
                .deadline(humanDeadline(violation, basis))
                .automated(false)
                .actionDetails(new ActionDetails.RemediationStep(i + 1, step, violation.getControlId())));
        }
        
        if (drafts.isEmpty()) {
            drafts.add(draft(violation)
                .actionType(ActionType.DOCUMENT)
                .priority(priorityFor(severity))
                .description(String.format("Review %s %s (%s) violation and record the outcome", 
                    violation.getFramework().getValue(), violation.getControlId(), violation.getControlName()))
                .assignee(frameworkOwner(violation.getFramework()))
                .deadline(humanDeadline(violation, basis))
                .automated(false));
        }
        
        return finalizeActions(violation, drafts);
    }
    
    private void planCriticalResponse(ComplianceViolation violation, Instant basis, 
            List<RequiredAction.RequiredActionBuilder> drafts) {
        Instant automatedDeadline = cap(plus(basis, config.getAutomatedResponse()), violation.getReportingDeadline());
        
        if (automationHooks.contains(ActionType.RESTRICT)) {
            drafts.add(draft(violation)
                .actionType(ActionType.RESTRICT)
                .priority(ActionPriority.IMMEDIATE)
                .description(String.format("Quarantine AI system %s pending review of %s %s", 
                    violation.getAiSystemId(), violation.getFramework().getValue(), violation.getControlId()))
                .assignee(null)
                .deadline(automatedDeadline)
                .automated(true)
                .actionDetails(new ActionDetails.Quarantine(violation.getAiSystemId(), false)));
        }
        
        if (violation.isRequiresReporting() && automationHooks.contains(ActionType.NOTIFY)) {
            drafts.add(draft(violation)
                .actionType(ActionType.NOTIFY)
                .priority(ActionPriority.IMMEDIATE)
                .description(String.format("Alert %s and CISO of reportable %s %s violation", 
                    label(reportingOwner(violation.getFramework())), 
                    violation.getFramework().getValue(), violation.getControlId()))
                .assignee(null)
                .deadline(automatedDeadline)
                .automated(true)
                .actionDetails(new ActionDetails.Notification(ALERT_CHANNELS, 
                    distinct(reportingOwner(violation.getFramework()), Assignee.CISO))));
        }
        
        drafts.add(draft(violation)
            .actionType(ActionType.ESCALATE)
            .priority(ActionPriority.URGENT)
            .description(String.format("Escalate critical %s %s (%s) violation to CISO", 
                violation.getFramework().getValue(), violation.getControlId(), violation.getControlName()))
            .assignee(Assignee.CISO)
            .deadline(cap(plus(basis, config.getCriticalResponse()), violation.getReportingDeadline()))
            .automated(false)
            .actionDetails(new ActionDetails.Escalation(escalationPath(violation.getFramework()))));
    }
    
    private List<RequiredAction> finalizeActions(ComplianceViolation violation, 
            List<RequiredAction.RequiredActionBuilder> drafts) {
        Set<String> seen = new HashSet<>();
        List<RequiredAction> unique = new ArrayList<>();
        for (RequiredAction.RequiredActionBuilder draft : drafts) {
            RequiredAction action = draft.build();
            String signature = action.getActionType() + "|" + action.getAssignee() + "|" 
                + action.getDescription().toLowerCase(Locale.ROOT);
            if (seen.add(signature)) {
                unique.add(action);
            }
        }
        
        // List.sort is stable, so equal priority and deadline keep planning order
        unique.sort(BY_PRIORITY_THEN_DEADLINE);
        
        List<RequiredAction> actions = new ArrayList<>(unique.size());
        for (int i = 0; i < unique.size(); i++) {
            actions.add(unique.get(i).toBuilder()
                .id(actionId(violation.getId(), i))
                .build());
        }
        return List.copyOf(actions);
    }
    
    private RequiredAction.RequiredActionBuilder draft(ComplianceViolation violation) {
        return RequiredAction.builder()
            .violationId(violation.getId())
            .aiSystemId(violation.getAiSystemId())
            .status(ActionStatus.PENDING);
    }
    
    static ActionType inferActionType(String step) {
        String verb = step.trim().split("\\s+", 2)[0]
            .replaceAll("[^A-Za-z]", "")
            .toLowerCase(Locale.ROOT);
        return switch (verb) {
            case "rollback", "roll", "revert" -> ActionType.ROLLBACK;
            case "notify", "report", "alert", "inform" -> ActionType.NOTIFY;
            case "document", "record", "update", "log" -> ActionType.DOCUMENT;
            case "escalate" -> ActionType.ESCALATE;
            case "restrict", "suspend", "quarantine", "disable", "block", "revoke" -> ActionType.RESTRICT;
            default -> ActionType.REMEDIATE;
        };
    }
    
    static ActionPriority priorityFor(Severity severity) {
        return switch (severity) {
            case CRITICAL -> ActionPriority.URGENT;
            case HIGH -> ActionPriority.HIGH;
            case MEDIUM -> ActionPriority.MEDIUM;
            case LOW -> ActionPriority.LOW;
        };
    }
    
    private Instant humanDeadline(ComplianceViolation violation, Instant basis) {
        Duration window = switch (violation.getSeverity()) {
            case CRITICAL -> config.getCriticalResponse();
            case HIGH -> config.getHighResponse();
            case MEDIUM -> config.getMediumResponse();
            case LOW -> null;
        };
        return cap(plus(basis, window), violation.getReportingDeadline());
    }
    
    static Assignee assigneeFor(ActionType type, Framework framework) {
        return switch (type) {
            case ROLLBACK, RESTRICT -> Assignee.IT_OWNER;
            case DOCUMENT -> Assignee.COMPLIANCE_OFFICER;
            case ESCALATE -> Assignee.CISO;
            case NOTIFY -> reportingOwner(framework);
            case REMEDIATE -> frameworkOwner(framework);
        };
    }
    
    static Assignee frameworkOwner(Framework framework) {
        return switch (framework) {
            case HIPAA, CA_SB1047 -> Assignee.PRIVACY_OFFICER;
            case NIST_AI_RMF, ISO_42001 -> Assignee.CISO;
            case FDA_SAMD -> Assignee.CLINICAL_OWNER;
            case NYC_LL144 -> Assignee.COMPLIANCE_OFFICER;
        };
    }
    
    static Assignee reportingOwner(Framework framework) {
        return framework == Framework.HIPAA || framework == Framework.CA_SB1047 
            ? Assignee.PRIVACY_OFFICER 
            : Assignee.COMPLIANCE_OFFICER;
    }
    
    private static List<Assignee> escalationPath(Framework framework) {
        return switch (framework) {
            case HIPAA, CA_SB1047 -> List.of(Assignee.PRIVACY_OFFICER, Assignee.CISO, Assignee.COMPLIANCE_OFFICER);
            case FDA_SAMD -> List.of(Assignee.CISO, Assignee.COMPLIANCE_OFFICER, Assignee.CLINICAL_OWNER);
            default -> List.of(Assignee.CISO, Assignee.COMPLIANCE_OFFICER);
        };
    }
    
    private static List<Assignee> distinct(Assignee first, Assignee second) {
        return first == second ? List.of(first) : List.of(first, second);
    }
    
    private static String label(Assignee assignee) {
        return assignee.getValue().replace('_', ' ');
    }
    
    private static Instant plus(Instant basis, Duration window) {
        return basis != null && window != null ? basis.plus(window) : null;
    }
    
    /**
     * Earlier of the two deadlines. A missing deadline is bounded only by the reporting deadline.
     */
    private static Instant cap(Instant deadline, Instant reportingDeadline) {
        if (deadline == null) {
            return reportingDeadline;
        }
        if (reportingDeadline != null && reportingDeadline.isBefore(deadline)) {
            return reportingDeadline;
        }
        return deadline;
    }
    
    static String actionId(String violationId, int index) {
        return UUID.nameUUIDFromBytes((violationId + "#" + index).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
