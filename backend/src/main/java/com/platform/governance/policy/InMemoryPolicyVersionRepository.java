package com.platform.governance.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory policy store used for local runs and tests.
 * Readers always see either the old or the new active version, never both.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "governance.policy.store", havingValue = "memory")
public class InMemoryPolicyVersionRepository implements PolicyVersionRepository {
    
    private final Map<PolicyKey, List<PolicyVersion>> lineages = new ConcurrentHashMap<>();
    private final Map<PolicyKey, List<PolicyChangeLog>> changeLogs = new ConcurrentHashMap<>();
    
    @Override
    public Optional<PolicyVersion> findActive(PolicyKey key) {
        return snapshot(key).stream()
            .filter(PolicyVersion::isActive)
            .findFirst();
    }
    
    @Override
    public Optional<PolicyVersion> findByVersion(PolicyKey key, SemanticVersion version) {
        return snapshot(key).stream()
            .filter(candidate -> candidate.getVersion().equals(version))
            .findFirst();
    }
    
    @Override
    public List<PolicyVersion> findLineage(PolicyKey key) {
        List<PolicyVersion> versions = new ArrayList<>(snapshot(key));
        versions.sort(Comparator.comparing(PolicyVersion::getVersion));
        return versions;
    }
    
    @Override
    public PolicyVersion activate(PolicyVersion newVersion, PolicyChangeLog changeLog) {
        PolicyKey key = newVersion.key();
        List<PolicyVersion> updated = new ArrayList<>();
        for (PolicyVersion existing : lineages.getOrDefault(key, List.of())) {
            PolicyVersion copy = existing.toBuilder().build();
            if (copy.isActive()) {
                copy.deprecate(newVersion.getEffectiveDate());
            }
            updated.add(copy);
        }
        updated.add(newVersion.toBuilder().build());
        
        // Swap the whole lineage so readers never observe a partial update
        synchronized (this) {
            lineages.put(key, List.copyOf(updated));
            List<PolicyChangeLog> entries = new ArrayList<>(changeLogs.getOrDefault(key, List.of()));
            entries.add(changeLog);
            changeLogs.put(key, List.copyOf(entries));
        }
        
        log.debug("Activated policy version {} for {}", newVersion.getVersion(), key);
        return newVersion.toBuilder().build();
    }
    
    @Override
    public List<PolicyChangeLog> findChangeLog(PolicyKey key) {
        return changeLogs.getOrDefault(key, List.of());
    }
    
    private List<PolicyVersion> snapshot(PolicyKey key) {
        return copyOf(lineages.getOrDefault(key, List.of()));
    }
    
    private static List<PolicyVersion> copyOf(List<PolicyVersion> versions) {
        return versions.stream()
            .map(version -> version.toBuilder().build())
            .toList();
    }
}
