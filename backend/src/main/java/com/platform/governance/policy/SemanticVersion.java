package com.platform.governance.policy;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MAJOR.MINOR.PATCH policy version.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {
    
    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);
    
    private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");
    
    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative");
        }
    }
    
    public static SemanticVersion parse(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher matcher = FORMAT.matcher(version.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a semantic version: " + version);
        }
        return new SemanticVersion(
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            Integer.parseInt(matcher.group(3)));
    }
    
    public SemanticVersion bump(VersionBump bump) {
        return switch (bump) {
            case MAJOR -> new SemanticVersion(major + 1, 0, 0);
            case MINOR -> new SemanticVersion(major, minor + 1, 0);
            case PATCH -> new SemanticVersion(major, minor, patch + 1);
        };
    }
    
    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }
    
    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
