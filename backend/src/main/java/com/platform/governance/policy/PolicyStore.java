package com.platform.governance.policy;

import com.platform.governance.crypto.PolicyCipher;
import com.platform.governance.crypto.PolicyHasher;
import com.platform.governance.error.ErrorCode;
import com.platform.governance.error.PolicyIntegrityException;
import com.platform.governance.error.ResourceNotFoundException;
import com.platform.governance.error.SerializationException;
import com.platform.governance.error.ValidationException;
import com.platform.governance.observability.MetricsRegistry;
import com.platform.governance.observability.StructuredLogger;
import com.platform.governance.policy.PolicyChangeLog.ChangeType;
import com.platform.governance.telemetry.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versioned, encrypted, integrity-checked storage of policy rule logic.
 * 
 * Writes are serialized per (eventType, framework) key. Reads take no lock and
 * verify the stored hash on every call.
 */
@Slf4j
@Service
public class PolicyStore {
    
    private final PolicyVersionRepository repository;
    private final PolicyCipher cipher;
    private final PolicyHasher hasher;
    private final PolicyRuleCodec codec;
    private final PolicyRuleValidator validator;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    private final Map<PolicyKey, ReentrantLock> writeLocks = new ConcurrentHashMap<>();
    
    public PolicyStore(
            PolicyVersionRepository repository,
            PolicyCipher cipher,
            PolicyHasher hasher,
            PolicyRuleCodec codec,
            PolicyRuleValidator validator,
            StructuredLogger structuredLogger,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.repository = repository;
        this.cipher = cipher;
        this.hasher = hasher;
        this.codec = codec;
        this.validator = validator;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    /**
     * Create and activate a new policy version, deprecating the current one.
     * The first version of a key is always 1.0.0 regardless of the bump type.
     * 
     * @return id of the new policy version
     */
    public String createPolicyVersion(EventType eventType, Framework framework, VersionBump versionBump,
            PolicyRuleLogic ruleLogic, String createdBy, String changeReason) {
        if (eventType == null) {
            throw ValidationException.missing("eventType");
        }
        if (framework == null) {
            throw ValidationException.missing("framework");
        }
        if (versionBump == null) {
            throw ValidationException.missing("versionBumpType");
        }
        validator.validate(ruleLogic, createdBy);
        
        return publish(PolicyKey.of(eventType, framework), versionBump, ruleLogic, createdBy, 
            changeReason, ChangeType.CREATED).getId();
    }
    
    /**
     * Active rule logic for the key, verified against its stored hash.
     * Empty when the key has no active version.
     * 
     * @throws PolicyIntegrityException if decryption or hash verification fails
     */
    public Optional<PolicyRuleLogic> getActivePolicy(EventType eventType, Framework framework) {
        return getActiveVerifiedPolicy(PolicyKey.of(eventType, framework))
            .map(VerifiedPolicy::ruleLogic);
    }
    
    /**
     * Like {@link #getActivePolicy} but also returns the version that produced the logic.
     */
    public Optional<VerifiedPolicy> getActiveVerifiedPolicy(PolicyKey key) {
        return repository.findActive(key).map(this::verify);
    }
    
    public boolean hasActivePolicy(PolicyKey key) {
        return repository.findActive(key).isPresent();
    }
    
    /**
     * Version metadata of the key, oldest version first. Never decrypts.
     */
    public List<PolicyHistoryEntry> getPolicyHistory(EventType eventType, Framework framework) {
        return repository.findLineage(PolicyKey.of(eventType, framework)).stream()
            .map(PolicyHistoryEntry::from)
            .toList();
    }
    
    public List<PolicyChangeLog> getChangeLog(EventType eventType, Framework framework) {
        return repository.findChangeLog(PolicyKey.of(eventType, framework));
    }
    
    /**
     * Republish the verified content of a historical version as a new PATCH version.
     * The historical version stays deprecated.
     * 
     * @return id of the new policy version
     */
    public String rollbackTo(EventType eventType, Framework framework, String targetVersion,
            String actor, String reason) {
        if (actor == null || actor.isBlank()) {
            throw ValidationException.missing("actor");
        }
        SemanticVersion target;
        try {
            target = SemanticVersion.parse(targetVersion);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidValue("targetVersion", targetVersion, "not a semantic version");
        }
        
        PolicyKey key = PolicyKey.of(eventType, framework);
        PolicyVersion historical = repository.findByVersion(key, target)
            .orElseThrow(() -> ResourceNotFoundException.versionNotFound(key, target.toString()));
        if (historical.isActive()) {
            throw ValidationException.invalidValue("targetVersion", targetVersion, "is already the active version");
        }
        
        PolicyRuleLogic restored = verify(historical).ruleLogic();
        String changeReason = reason != null && !reason.isBlank() 
            ? reason 
            : "Rollback to version " + target;
        PolicyVersion created = publish(key, VersionBump.PATCH, restored, actor, changeReason, ChangeType.ROLLED_BACK);
        
        structuredLogger.policy().rolledBack(created.getId(), key.toString(), 
            created.getVersion().toString(), target.toString(), actor);
        return created.getId();
    }
    
    private PolicyVersion publish(PolicyKey key, VersionBump versionBump, PolicyRuleLogic ruleLogic,
            String actor, String changeReason, ChangeType changeType) {
        ReentrantLock lock = writeLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<PolicyVersion> active = repository.findActive(key);
            SemanticVersion nextVersion = active
                .map(current -> current.getVersion().bump(versionBump))
                .orElse(SemanticVersion.INITIAL);
            
            String plaintext = codec.toCanonicalJson(ruleLogic);
            String ruleHash = hasher.hash(plaintext);
            String encrypted = cipher.encrypt(plaintext, associatedData(key, nextVersion));
            
            Instant now = clock.instant();
            PolicyVersion version = PolicyVersion.builder()
                .id(UUID.randomUUID().toString())
                .eventType(key.eventType())
                .framework(key.framework())
                .version(nextVersion)
                .encryptedRuleLogic(encrypted)
                .ruleHash(ruleHash)
                .status(PolicyStatus.ACTIVE)
                .effectiveDate(now)
                .createdBy(actor)
                .createdAt(now)
                .build();
            
            String previousVersion = active.map(current -> current.getVersion().toString()).orElse(null);
            PolicyChangeLog changeLog = PolicyChangeLog.builder()
                .id(UUID.randomUUID().toString())
                .policyVersionId(version.getId())
                .eventType(key.eventType())
                .framework(key.framework())
                .changeType(changeType)
                .previousVersion(previousVersion)
                .newVersion(nextVersion.toString())
                .changeReason(changeReason)
                .changedBy(actor)
                .changedAt(now)
                .build();
            
            PolicyVersion stored = repository.activate(version, changeLog);
            
            structuredLogger.policy().versionCreated(stored.getId(), key.toString(), 
                nextVersion.toString(), previousVersion, actor);
            metricsRegistry.recordPolicyVersionCreated(key.toString(), changeType.getValue());
            return stored;
        } finally {
            lock.unlock();
        }
    }
    
    private VerifiedPolicy verify(PolicyVersion version) {
        PolicyKey key = version.key();
        String plaintext;
        try {
            plaintext = cipher.decrypt(version.getEncryptedRuleLogic(), associatedData(key, version.getVersion()));
        } catch (PolicyIntegrityException e) {
            throw integrityFailure(version, e.getMessage(), e);
        }
        
        if (!hasher.matches(plaintext, version.getRuleHash())) {
            throw integrityFailure(version, "Policy content does not match its integrity hash", null);
        }
        
        try {
            return new VerifiedPolicy(version.getId(), key, version.getVersion(), codec.fromJson(plaintext));
        } catch (SerializationException e) {
            throw integrityFailure(version, "Verified policy content could not be parsed", e);
        }
    }
    
    private PolicyIntegrityException integrityFailure(PolicyVersion version, String message, Throwable cause) {
        String key = version.key().toString();
        String detail = String.format("%s (policy %s version %s)", message, key, version.getVersion());
        structuredLogger.policy().integrityFailure(version.getId(), key, 
            ErrorCode.POLICY_INTEGRITY_VIOLATION.getCode(), detail);
        metricsRegistry.recordIntegrityFailure(key);
        return cause != null 
            ? new PolicyIntegrityException(version.getId(), detail, cause)
            : new PolicyIntegrityException(version.getId(), detail);
    }
    
    static String associatedData(PolicyKey key, SemanticVersion version) {
        return key.eventType().getValue() + "|" + key.framework().getValue() + "|" + version;
    }
}
