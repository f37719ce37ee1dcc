package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which component of the semantic version a new policy version increments.
 */
public enum VersionBump {
    MAJOR,
    MINOR,
    PATCH;
    
    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
    
    @JsonCreator
    public static VersionBump fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VersionBump bump : values()) {
            if (bump.name().equalsIgnoreCase(value.trim())) {
                return bump;
            }
        }
        throw new IllegalArgumentException("Unknown version bump type: " + value);
    }
}
