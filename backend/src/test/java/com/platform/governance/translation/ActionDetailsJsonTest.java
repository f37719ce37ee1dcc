package com.platform.governance.translation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.governance.policy.Framework;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.platform.governance.GovernanceFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ActionDetails JSON")
class ActionDetailsJsonTest {
    
    private final ObjectMapper mapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .build();
    
    @Test
    @DisplayName("Should tag details with their kind and write enums in lowercase")
    void shouldWriteDiscriminator() throws Exception {
        RequiredAction action = RequiredAction.builder()
            .id("act-1")
            .violationId("viol-1")
            .actionType(ActionType.RESTRICT)
            .priority(ActionPriority.IMMEDIATE)
            .description("Quarantine AI system")
            .automated(true)
            .actionDetails(new ActionDetails.Quarantine("sys-radiology-01", false))
            .build();
        
        String json = mapper.writeValueAsString(action);
        
        assertThat(json)
            .contains("\"kind\":\"quarantine\"")
            .contains("\"actionType\":\"restrict\"")
            .contains("\"priority\":\"immediate\"")
            .contains("\"status\":\"pending\"");
        assertThat(mapper.readValue(json, RequiredAction.class)).isEqualTo(action);
    }
    
    @Test
    @DisplayName("Should read each known detail shape back as its own type")
    void shouldReadKnownShapes() throws Exception {
        List<ActionDetails> details = List.of(
            new ActionDetails.Notification(List.of("email"), List.of(Assignee.PRIVACY_OFFICER, Assignee.CISO)),
            new ActionDetails.Escalation(List.of(Assignee.CISO, Assignee.COMPLIANCE_OFFICER)),
            new ActionDetails.RegulatoryReport(Framework.HIPAA, "164.402", NOW),
            new ActionDetails.RemediationStep(2, "Notify affected individuals", "164.402"));
        
        for (ActionDetails detail : details) {
            String json = mapper.writeValueAsString(detail);
            assertThat(mapper.readValue(json, ActionDetails.class)).isEqualTo(detail);
        }
    }
    
    @Test
    @DisplayName("Should carry opaque details as versioned bytes")
    void shouldCarryOpaquePayload() throws Exception {
        byte[] payload = "{\"runbook\":\"rb-42\"}".getBytes(StandardCharsets.UTF_8);
        ActionDetails.Opaque opaque = new ActionDetails.Opaque(3, payload);
        payload[0] = 'x';
        
        String json = mapper.writeValueAsString(opaque);
        ActionDetails read = mapper.readValue(json, ActionDetails.class);
        
        assertThat(json).contains("\"kind\":\"opaque\"").contains("\"schemaVersion\":3");
        assertThat(read).isEqualTo(opaque);
        assertThat(((ActionDetails.Opaque) read).payload()[0]).isEqualTo((byte) '{');
    }
}
