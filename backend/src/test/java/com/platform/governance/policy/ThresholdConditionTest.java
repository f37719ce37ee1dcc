package com.platform.governance.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.governance.policy.ThresholdCondition.AllOf;
import com.platform.governance.policy.ThresholdCondition.AnyOf;
import com.platform.governance.policy.ThresholdCondition.Compare;
import com.platform.governance.policy.ThresholdCondition.ConfiguredThreshold;
import com.platform.governance.policy.ThresholdCondition.ExceedsThreshold;
import com.platform.governance.policy.ThresholdCondition.MetricIs;
import com.platform.governance.policy.ThresholdCondition.Operator;
import com.platform.governance.telemetry.EventType;
import com.platform.governance.telemetry.TelemetryEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.platform.governance.GovernanceFixtures.driftEvent;
import static com.platform.governance.GovernanceFixtures.event;
import static com.platform.governance.GovernanceFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ThresholdCondition")
class ThresholdConditionTest {
    
    @Nested
    @DisplayName("compare")
    class CompareTests {
        
        @Test
        @DisplayName("Should compare metricValue numerically")
        void shouldCompareMetricValue() {
            TelemetryEvent event = driftEvent();
            
            assertThat(new Compare("metricValue", Operator.GT, new BigDecimal("0.3")).evaluate(event)).isTrue();
            assertThat(new Compare("metricValue", Operator.LT, new BigDecimal("0.3")).evaluate(event)).isFalse();
            assertThat(new Compare("metricValue", Operator.EQ, new BigDecimal("0.350")).evaluate(event)).isTrue();
            assertThat(new Compare("threshold", Operator.LTE, new BigDecimal("0.2")).evaluate(event)).isTrue();
        }
        
        @Test
        @DisplayName("Should read nested payload paths")
        void shouldReadPayloadPath() {
            TelemetryEvent event = event(EventType.BIAS)
                .payload(payload().set("fairness", payload().put("disparity", 0.42)))
                .build();
            
            assertThat(new Compare("payload.fairness.disparity", Operator.GTE, new BigDecimal("0.4")).evaluate(event))
                .isTrue();
        }
        
        @Test
        @DisplayName("Should be false when the operand is missing or not numeric")
        void shouldBeFalseForMissingOperand() {
            TelemetryEvent noValue = event(EventType.DRIFT).build();
            TelemetryEvent textValue = event(EventType.DRIFT).metricValue("n/a").build();
            Compare condition = new Compare("metricValue", Operator.NEQ, BigDecimal.ONE);
            
            assertThat(condition.evaluate(noValue)).isFalse();
            assertThat(condition.evaluate(textValue)).isFalse();
            assertThat(new Compare("payload.absent", Operator.LT, BigDecimal.TEN).evaluate(driftEvent())).isFalse();
        }
    }
    
    @Test
    @DisplayName("Should apply percentage margin for exceeds_threshold")
    void shouldApplyPercentageMargin() {
        TelemetryEvent event = driftEvent(); // 0.35 vs 0.2 is 75% over
        
        assertThat(new ExceedsThreshold(null).evaluate(event)).isTrue();
        assertThat(new ExceedsThreshold(new BigDecimal("50")).evaluate(event)).isTrue();
        assertThat(new ExceedsThreshold(new BigDecimal("75")).evaluate(event)).isFalse();
        assertThat(new ExceedsThreshold(new BigDecimal("100")).evaluate(event)).isFalse();
    }
    
    @Test
    @DisplayName("Should combine conditions with all and any")
    void shouldCombineConditions() {
        TelemetryEvent event = driftEvent();
        ThresholdCondition isDrift = new MetricIs("DRIFT_SCORE");
        ThresholdCondition isLatency = new MetricIs("latency_ms");
        ThresholdCondition exceeded = new ExceedsThreshold(BigDecimal.ZERO);
        
        assertThat(new AllOf(List.of(isDrift, exceeded)).evaluate(event)).isTrue();
        assertThat(new AllOf(List.of(isLatency, exceeded)).evaluate(event)).isFalse();
        assertThat(new AnyOf(List.of(isLatency, exceeded)).evaluate(event)).isTrue();
        assertThat(new AnyOf(List.of()).evaluate(event)).isFalse();
    }
    
    @Test
    @DisplayName("Should compare against a named threshold from the lookup")
    void shouldCompareConfiguredThreshold() {
        TelemetryEvent event = driftEvent();
        ConfiguredThreshold condition = new ConfiguredThreshold("metricValue", Operator.GT, "drift.accuracyDropHigh");
        
        assertThat(condition.evaluate(event, name -> Optional.of(new BigDecimal("0.30")))).isTrue();
        assertThat(condition.evaluate(event, name -> Optional.of(new BigDecimal("0.40")))).isFalse();
        assertThat(condition.evaluate(event)).isFalse();
        assertThat(new AnyOf(List.of(condition)).evaluate(event, name -> Optional.of(BigDecimal.ZERO))).isTrue();
    }
    
    @Test
    @DisplayName("Should deserialize the tagged JSON form")
    void shouldDeserializeTaggedJson() throws Exception {
        String json = """
            {"type":"all","conditions":[
              {"type":"metric_is","metric":"drift_score"},
              {"type":"compare","field":"metricValue","operator":"gt","value":0.3}
            ]}
            """;
        
        ThresholdCondition condition = new ObjectMapper().readValue(json, ThresholdCondition.class);
        
        assertThat(condition).isInstanceOf(AllOf.class);
        assertThat(condition.evaluate(driftEvent())).isTrue();
        assertThat(condition.describe()).isEqualTo("(metric is 'drift_score' AND metricValue > 0.3)");
    }
    
    @Test
    @DisplayName("Should deserialize a configured threshold reference")
    void shouldDeserializeConfiguredThreshold() throws Exception {
        String json = """
            {"type":"configured_threshold","field":"payload.variance","operator":"gte","threshold":"bias.varianceNYC"}
            """;
        
        ThresholdCondition condition = new ObjectMapper().readValue(json, ThresholdCondition.class);
        
        assertThat(condition).isEqualTo(new ConfiguredThreshold("payload.variance", Operator.GTE, "bias.varianceNYC"));
    }
}
