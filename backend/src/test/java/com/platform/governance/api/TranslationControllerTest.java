package com.platform.governance.api;

import com.platform.governance.crypto.DeterministicPolicyCipher;
import com.platform.governance.error.GlobalExceptionHandler;
import com.platform.governance.policy.Framework;
import com.platform.governance.policy.InMemoryPolicyVersionRepository;
import com.platform.governance.policy.PolicyStore;
import com.platform.governance.policy.Severity;
import com.platform.governance.policy.VersionBump;
import com.platform.governance.telemetry.EventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.platform.governance.GovernanceFixtures.FIXED_CLOCK;
import static com.platform.governance.GovernanceFixtures.logic;
import static com.platform.governance.GovernanceFixtures.metricsRegistry;
import static com.platform.governance.GovernanceFixtures.orchestrator;
import static com.platform.governance.GovernanceFixtures.policyStore;
import static com.platform.governance.GovernanceFixtures.rule;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("TranslationController")
class TranslationControllerTest {
    
    private PolicyStore store;
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        store = policyStore(new InMemoryPolicyVersionRepository(), new DeterministicPolicyCipher(), FIXED_CLOCK);
        mockMvc = MockMvcBuilders.standaloneSetup(new TranslationController(orchestrator(store), FIXED_CLOCK))
            .setControllerAdvice(new GlobalExceptionHandler(metricsRegistry()))
            .build();
    }
    
    @Test
    @DisplayName("Should preview violations for a drift event")
    void shouldPreviewTranslation() throws Exception {
        store.createPolicyVersion(EventType.DRIFT, Framework.NIST_AI_RMF, VersionBump.MAJOR,
            logic(rule(Framework.NIST_AI_RMF, "MEASURE-2.3", Severity.CRITICAL)
                .requiresReporting(true)
                .reportingDeadlineDays(1)
                .build()),
            "compliance-team", "Initial policy");
        
        mockMvc.perform(post("/api/translations/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "evt-100", "aiSystemId": "sys-radiology-01", "eventType": "drift",
                     "source": "arize", "metric": "drift_score", "metricValue": "0.35", "threshold": "0.2"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.violations", hasSize(1)))
            .andExpect(jsonPath("$.violations[0].severity").value("critical"))
            .andExpect(jsonPath("$.violations[0].reportingDeadline").value("2025-03-15T09:26:53Z"))
            .andExpect(jsonPath("$.riskAssessment.level").value("Critical"))
            .andExpect(jsonPath("$.translatedAt").value("2025-03-14T09:26:53Z"));
    }
    
    @Test
    @DisplayName("Should reject an event without an event type")
    void shouldRejectMissingEventType() throws Exception {
        mockMvc.perform(post("/api/translations/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\": \"evt-100\", \"source\": \"arize\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors[0].field").value("eventType"));
    }
}
