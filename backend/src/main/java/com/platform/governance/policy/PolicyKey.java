package com.platform.governance.policy;

import com.platform.governance.telemetry.EventType;

import java.util.Objects;

/**
 * Identifies a policy lineage: one event type evaluated against one framework.
 */
public record PolicyKey(EventType eventType, Framework framework) {
    
    public PolicyKey {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(framework, "framework");
    }
    
    public static PolicyKey of(EventType eventType, Framework framework) {
        return new PolicyKey(eventType, framework);
    }
    
    @Override
    public String toString() {
        return eventType.getValue() + "/" + framework.getValue();
    }
}
