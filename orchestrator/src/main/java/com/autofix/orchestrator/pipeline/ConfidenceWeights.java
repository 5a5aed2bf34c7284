package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.model.AgentRole;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-stage weights for the aggregate confidence of a successful run.
 *
 * Arithmetic is done in decimal so that the weighted sum is exact before it is
 * cut to two places (truncated, not rounded half-up): 0.15·0.9 + 0.20·0.8 +
 * 0.35·0.7 + 0.30·0.85 = 0.795 aggregates to 0.79.
 *
 * Truncation differs from rounding to nearest in the second decimal: 0.927
 * (stage confidences 0.9, 0.9, 0.9 and 0.99) aggregates to 0.92, where a
 * half-up rounding would report 0.93.
 */
public final class ConfidenceWeights {

    public static final ConfidenceWeights DEFAULT = of(Map.of(
            "triage", 0.15, "research", 0.20, "fix", 0.35, "review", 0.30));

    private final Map<AgentRole, BigDecimal> weights;

    private ConfidenceWeights(Map<AgentRole, BigDecimal> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Build from stage key → weight.
     *
     * @throws IllegalArgumentException if a stage is missing or unknown, a
     *         weight is negative, or the weights do not sum to 1.0
     */
    public static ConfidenceWeights of(Map<String, Double> byKey) {
        Map<AgentRole, BigDecimal> weights = new EnumMap<>(AgentRole.class);
        for (Map.Entry<String, Double> entry : byKey.entrySet()) {
            AgentRole role = roleOf(entry.getKey());
            double weight = entry.getValue() == null ? -1 : entry.getValue();
            if (weight < 0) {
                throw new IllegalArgumentException("Weight for " + entry.getKey() + " must be >= 0");
            }
            weights.put(role, BigDecimal.valueOf(weight));
        }
        for (AgentRole role : AgentRole.values()) {
            if (!weights.containsKey(role)) {
                throw new IllegalArgumentException("Missing confidence weight for " + role.key());
            }
        }
        BigDecimal sum = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (sum.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("Confidence weights must sum to 1.0, got " + sum.toPlainString());
        }
        return new ConfidenceWeights(weights);
    }

    public double weight(AgentRole role) {
        return weights.get(role).doubleValue();
    }

    /**
     * Weighted sum over the four roles, truncated to two decimals. A role with
     * no confidence counts as zero.
     */
    public Aggregate aggregate(Map<AgentRole, Double> confidences) {
        BigDecimal total = BigDecimal.ZERO;
        Map<String, Double> breakdown = new LinkedHashMap<>();
        for (AgentRole role : AgentRole.values()) {
            double confidence = confidences.getOrDefault(role, 0.0);
            breakdown.put(role.key(), confidence);
            total = total.add(weights.get(role).multiply(BigDecimal.valueOf(confidence)));
        }
        return new Aggregate(total.setScale(2, RoundingMode.DOWN).doubleValue(), breakdown);
    }

    /** Scalar aggregate plus the per-stage confidences it was computed from. */
    public record Aggregate(double value, Map<String, Double> breakdown) {
        public Aggregate {
            breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        }
    }

    private static AgentRole roleOf(String key) {
        for (AgentRole role : AgentRole.values()) {
            if (role.key().equals(key.toLowerCase(Locale.ROOT))) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown stage in confidence weights: " + key);
    }
}
