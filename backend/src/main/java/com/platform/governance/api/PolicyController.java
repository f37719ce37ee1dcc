package com.platform.governance.api;

import com.platform.governance.error.ResourceNotFoundException;
import com.platform.governance.error.ValidationException;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.PolicyChangeLog;
import com.platform.governance.policy.PolicyHistoryEntry;
import com.platform.governance.policy.PolicyKey;
import com.platform.governance.policy.PolicyRule;
import com.platform.governance.policy.PolicyRuleLogic;
import com.platform.governance.policy.PolicyStore;
import com.platform.governance.policy.VerifiedPolicy;
import com.platform.governance.policy.VersionBump;
import com.platform.governance.telemetry.EventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for policy version administration.
 * Rule content is accepted on create but never returned.
 */
@RestController
@RequestMapping("/api/policies/{eventType}/{framework}")
@AllArgsConstructor
public class PolicyController {
    
    private final PolicyStore policyStore;
    
    /**
     * Create and activate a new policy version.
     */
    @PostMapping("/versions")
    public ResponseEntity<PolicyVersionCreatedDTO> createVersion(
            @PathVariable String eventType,
            @PathVariable String framework,
            @Valid @RequestBody PolicyVersionCreateRequest request) {
        
        EventType type = parseEventType(eventType);
        Framework fw = parseFramework(framework);
        String id = policyStore.createPolicyVersion(type, fw, request.versionBumpType, 
            request.ruleLogic, request.createdBy, request.changeReason);
        
        return ResponseEntity.status(HttpStatus.CREATED).body(created(id, type, fw));
    }
    
    /**
     * Metadata of the verified active version.
     */
    @GetMapping("/active")
    public ActivePolicyDTO getActive(@PathVariable String eventType, @PathVariable String framework) {
        PolicyKey key = PolicyKey.of(parseEventType(eventType), parseFramework(framework));
        VerifiedPolicy policy = policyStore.getActiveVerifiedPolicy(key)
            .orElseThrow(() -> ResourceNotFoundException.noActivePolicy(key));
        
        List<String> controlIds = policy.ruleLogic().getRules().stream()
            .map(PolicyRule::getControlId)
            .toList();
        return new ActivePolicyDTO(policy.policyVersionId(), key.eventType().getValue(), 
            key.framework().getValue(), policy.version().toString(), controlIds.size(), controlIds);
    }
    
    @GetMapping("/history")
    public List<PolicyHistoryEntry> getHistory(@PathVariable String eventType, @PathVariable String framework) {
        return policyStore.getPolicyHistory(parseEventType(eventType), parseFramework(framework));
    }
    
    @GetMapping("/changes")
    public List<PolicyChangeLog> getChangeLog(@PathVariable String eventType, @PathVariable String framework) {
        return policyStore.getChangeLog(parseEventType(eventType), parseFramework(framework));
    }
    
    /**
     * Republish a historical version's content as a new patch version.
     */
    @PostMapping("/rollback")
    public ResponseEntity<PolicyVersionCreatedDTO> rollback(
            @PathVariable String eventType,
            @PathVariable String framework,
            @Valid @RequestBody RollbackRequest request) {
        
        EventType type = parseEventType(eventType);
        Framework fw = parseFramework(framework);
        String id = policyStore.rollbackTo(type, fw, request.targetVersion, request.actor, request.reason);
        
        return ResponseEntity.status(HttpStatus.CREATED).body(created(id, type, fw));
    }
    
    private PolicyVersionCreatedDTO created(String id, EventType type, Framework fw) {
        String version = policyStore.getPolicyHistory(type, fw).stream()
            .filter(entry -> entry.id().equals(id))
            .map(PolicyHistoryEntry::version)
            .findFirst()
            .orElse(null);
        return new PolicyVersionCreatedDTO(id, type.getValue(), fw.getValue(), version);
    }
    
    static EventType parseEventType(String value) {
        try {
            return EventType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidValue("eventType", value, "unknown event type");
        }
    }
    
    static Framework parseFramework(String value) {
        try {
            return Framework.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidValue("framework", value, "unknown framework");
        }
    }
    
    // DTOs
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PolicyVersionCreateRequest {
        @NotNull
        private VersionBump versionBumpType;
        @NotNull
        private PolicyRuleLogic ruleLogic;
        @NotBlank
        private String createdBy;
        private String changeReason;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RollbackRequest {
        @NotBlank
        private String targetVersion;
        @NotBlank
        private String actor;
        private String reason;
    }
    
    @Data
    @AllArgsConstructor
    public static class PolicyVersionCreatedDTO {
        private String id;
        private String eventType;
        private String framework;
        private String version;
    }
    
    @Data
    @AllArgsConstructor
    public static class ActivePolicyDTO {
        private String id;
        private String eventType;
        private String framework;
        private String version;
        private int ruleCount;
        private List<String> controlIds;
    }
}
