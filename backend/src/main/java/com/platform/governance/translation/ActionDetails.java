package com.platform.governance.translation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.platform.governance.policy.Framework;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Typed details attached to a required action, discriminated by {@code kind}.
 * Details of an unknown shape travel as {@link Opaque} bytes with a schema version.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = ActionDetails.Opaque.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ActionDetails.Quarantine.class, name = "quarantine"),
    @JsonSubTypes.Type(value = ActionDetails.Notification.class, name = "notification"),
    @JsonSubTypes.Type(value = ActionDetails.Escalation.class, name = "escalation"),
    @JsonSubTypes.Type(value = ActionDetails.RegulatoryReport.class, name = "regulatory_report"),
    @JsonSubTypes.Type(value = ActionDetails.RemediationStep.class, name = "remediation_step"),
    @JsonSubTypes.Type(value = ActionDetails.Opaque.class, name = "opaque")
})
public interface ActionDetails {
    
    /**
     * Isolate the AI system from production traffic.
     */
    record Quarantine(String aiSystemId, boolean requiresApproval) implements ActionDetails {
    }
    
    record Notification(List<String> channels, List<Assignee> recipients) implements ActionDetails {
        
        public Notification {
            channels = channels != null ? List.copyOf(channels) : List.of();
            recipients = recipients != null ? List.copyOf(recipients) : List.of();
        }
    }
    
    record Escalation(List<Assignee> escalationPath) implements ActionDetails {
        
        public Escalation {
            escalationPath = escalationPath != null ? List.copyOf(escalationPath) : List.of();
        }
    }
    
    record RegulatoryReport(Framework framework, String controlId, Instant reportingDeadline) implements ActionDetails {
    }
    
    /**
     * One remediation step of the violated rule. Step numbers start at 1.
     */
    record RemediationStep(int stepNumber, String step, String controlId) implements ActionDetails {
    }
    
    record Opaque(int schemaVersion, byte[] payload) implements ActionDetails {
        
        public Opaque {
            payload = payload != null ? payload.clone() : new byte[0];
        }
        
        @Override
        public byte[] payload() {
            return payload.clone();
        }
        
        @Override
        public boolean equals(Object other) {
            return other instanceof Opaque that 
                && schemaVersion == that.schemaVersion 
                && Arrays.equals(payload, that.payload);
        }
        
        @Override
        public int hashCode() {
            return 31 * schemaVersion + Arrays.hashCode(payload);
        }
        
        @Override
        public String toString() {
            return "Opaque[schemaVersion=" + schemaVersion + ", payload=" + payload.length + " bytes]";
        }
    }
}
