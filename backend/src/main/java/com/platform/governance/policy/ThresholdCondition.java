package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.platform.governance.telemetry.TelemetryEvent;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Declarative condition a rule applies to the metric fields of a telemetry event.
 * 
 * Conditions are data, never code: each variant is a fixed comparison shape
 * selected by the {@code type} discriminator. Numeric conditions evaluate to
 * false when an operand is missing or not a number. Named thresholds are
 * resolved through the {@link ThresholdLookup} of the evaluating organization.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ThresholdCondition.Compare.class, name = "compare"),
    @JsonSubTypes.Type(value = ThresholdCondition.ExceedsThreshold.class, name = "exceeds_threshold"),
    @JsonSubTypes.Type(value = ThresholdCondition.MetricIs.class, name = "metric_is"),
    @JsonSubTypes.Type(value = ThresholdCondition.ConfiguredThreshold.class, name = "configured_threshold"),
    @JsonSubTypes.Type(value = ThresholdCondition.AllOf.class, name = "all"),
    @JsonSubTypes.Type(value = ThresholdCondition.AnyOf.class, name = "any")
})
public interface ThresholdCondition {
    
    String FIELD_METRIC_VALUE = "metricValue";
    String FIELD_THRESHOLD = "threshold";
    String PAYLOAD_PREFIX = "payload.";
    
    /**
     * Evaluates this condition against the event's metric, threshold and payload values.
     */
    boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds);
    
    default boolean evaluate(TelemetryEvent event) {
        return evaluate(event, ThresholdLookup.NONE);
    }
    
    /**
     * Returns a human-readable description of this condition.
     */
    String describe();
    
    /**
     * Comparison operators supported by {@link Compare}.
     */
    enum Operator {
        GT("gt", ">"),
        GTE("gte", ">="),
        LT("lt", "<"),
        LTE("lte", "<="),
        EQ("eq", "=="),
        NEQ("neq", "!=");
        
        private final String value;
        private final String symbol;
        
        Operator(String value, String symbol) {
            this.value = value;
            this.symbol = symbol;
        }
        
        @JsonValue
        public String getValue() {
            return value;
        }
        
        public String getSymbol() {
            return symbol;
        }
        
        boolean test(int comparison) {
            return switch (this) {
                case GT -> comparison > 0;
                case GTE -> comparison >= 0;
                case LT -> comparison < 0;
                case LTE -> comparison <= 0;
                case EQ -> comparison == 0;
                case NEQ -> comparison != 0;
            };
        }
        
        @JsonCreator
        public static Operator fromValue(String value) {
            if (value == null) {
                return null;
            }
            for (Operator operator : values()) {
                if (operator.value.equalsIgnoreCase(value.trim()) || operator.symbol.equals(value.trim())) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown operator: " + value);
        }
    }
    
    /**
     * Numeric comparison of one event field against a constant.
     * Field is {@code metricValue}, {@code threshold} or {@code payload.<dotted.path>}.
     */
    record Compare(String field, Operator operator, BigDecimal value) implements ThresholdCondition {
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            if (operator == null || value == null) {
                return false;
            }
            return resolveNumber(event, field)
                .map(actual -> operator.test(actual.compareTo(value)))
                .orElse(false);
        }
        
        @Override
        public String describe() {
            return field + " " + (operator != null ? operator.getSymbol() : "?") + " " + value;
        }
    }
    
    /**
     * Matches when metricValue is above threshold by more than the given percentage.
     * A null or zero percentage means a plain {@code metricValue > threshold}.
     */
    record ExceedsThreshold(BigDecimal byPercent) implements ThresholdCondition {
        
        private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            Optional<BigDecimal> metricValue = resolveNumber(event, FIELD_METRIC_VALUE);
            Optional<BigDecimal> threshold = resolveNumber(event, FIELD_THRESHOLD);
            if (metricValue.isEmpty() || threshold.isEmpty()) {
                return false;
            }
            BigDecimal percent = byPercent != null ? byPercent : BigDecimal.ZERO;
            BigDecimal limit = threshold.get().multiply(BigDecimal.ONE.add(percent.divide(HUNDRED)));
            return metricValue.get().compareTo(limit) > 0;
        }
        
        @Override
        public String describe() {
            if (byPercent == null || byPercent.signum() == 0) {
                return "metricValue > threshold";
            }
            return "metricValue exceeds threshold by more than " + byPercent.stripTrailingZeros().toPlainString() + "%";
        }
    }
    
    /**
     * Matches when the event's metric name equals the given name (case-insensitive).
     */
    record MetricIs(String metric) implements ThresholdCondition {
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            return metric != null && event.getMetric() != null 
                && metric.trim().equalsIgnoreCase(event.getMetric().trim());
        }
        
        @Override
        public String describe() {
            return "metric is '" + metric + "'";
        }
    }
    
    /**
     * Numeric comparison of one event field against a named threshold, so that each
     * organization can tune sensitivity without republishing the policy. An unresolved
     * name evaluates to false.
     */
    record ConfiguredThreshold(String field, Operator operator, String threshold) implements ThresholdCondition {
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            if (operator == null || threshold == null) {
                return false;
            }
            Optional<BigDecimal> limit = thresholds.resolve(threshold);
            if (limit.isEmpty()) {
                return false;
            }
            return resolveNumber(event, field)
                .map(actual -> operator.test(actual.compareTo(limit.get())))
                .orElse(false);
        }
        
        @Override
        public String describe() {
            return field + " " + (operator != null ? operator.getSymbol() : "?") + " configured " + threshold;
        }
    }
    
    /**
     * All sub-conditions must be true (AND logic).
     */
    record AllOf(List<ThresholdCondition> conditions) implements ThresholdCondition {
        
        public AllOf {
            conditions = conditions != null ? List.copyOf(conditions) : List.of();
        }
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            if (conditions.isEmpty()) {
                return false;
            }
            for (ThresholdCondition condition : conditions) {
                if (!condition.evaluate(event, thresholds)) {
                    return false;
                }
            }
            return true;
        }
        
        @Override
        public String describe() {
            return conditions.stream()
                .map(ThresholdCondition::describe)
                .collect(Collectors.joining(" AND ", "(", ")"));
        }
    }
    
    /**
     * At least one sub-condition must be true (OR logic).
     */
    record AnyOf(List<ThresholdCondition> conditions) implements ThresholdCondition {
        
        public AnyOf {
            conditions = conditions != null ? List.copyOf(conditions) : List.of();
        }
        
        @Override
        public boolean evaluate(TelemetryEvent event, ThresholdLookup thresholds) {
            for (ThresholdCondition condition : conditions) {
                if (condition.evaluate(event, thresholds)) {
                    return true;
                }
            }
            return false;
        }
        
        @Override
        public String describe() {
            return conditions.stream()
                .map(ThresholdCondition::describe)
                .collect(Collectors.joining(" OR ", "(", ")"));
        }
    }
    
    /**
     * Reads a numeric operand from the event. Empty when absent or not numeric.
     */
    static Optional<BigDecimal> resolveNumber(TelemetryEvent event, String field) {
        if (field == null) {
            return Optional.empty();
        }
        if (FIELD_METRIC_VALUE.equals(field)) {
            return parse(event.getMetricValue());
        }
        if (FIELD_THRESHOLD.equals(field)) {
            return parse(event.getThreshold());
        }
        if (field.startsWith(PAYLOAD_PREFIX)) {
            return event.payloadValue(field.substring(PAYLOAD_PREFIX.length()))
                .flatMap(ThresholdCondition::toNumber);
        }
        return Optional.empty();
    }
    
    private static Optional<BigDecimal> toNumber(JsonNode node) {
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return Optional.empty();
    }
    
    private static Optional<BigDecimal> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
