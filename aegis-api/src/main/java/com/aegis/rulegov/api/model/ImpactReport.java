/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of replaying a proposed rule over a historical sample.
 *
 * <p>Rates are percentages of the sample with two decimals. {@code proposed} layers the rule
 * over the baseline decisions using {@code block > review > allow}; {@code delta} is
 * {@code proposed - baseline}.
 */
public record ImpactReport(
        @JsonProperty("sample_size") int sampleSize,
        @JsonProperty("match_count") int matchCount,
        @JsonProperty("match_rate") double matchRate,
        @JsonProperty("change_count") int changeCount,
        @JsonProperty("change_rate") double changeRate,
        @JsonProperty("baseline") DecisionRates baseline,
        @JsonProperty("proposed") DecisionRates proposed,
        @JsonProperty("delta") DecisionRates delta,
        @JsonProperty("examples") List<ChangeExample> examples,
        @JsonProperty("false_positive_risk") FalsePositiveRisk falsePositiveRisk,
        @JsonProperty("strata") Map<String, Integer> strata,
        @JsonProperty("elapsed_ms") long elapsedMillis,
        @JsonProperty("computed_at") Instant computedAt
) {
    public ImpactReport {
        examples = examples == null ? List.of() : List.copyOf(examples);
        strata = strata == null ? Map.of() : Map.copyOf(strata);
    }

    /**
     * Share of the sample per decision, in percent.
     */
    public record DecisionRates(
            @JsonProperty("allow") double allow,
            @JsonProperty("review") double review,
            @JsonProperty("block") double block
    ) {
        public static DecisionRates fromCounts(int allow, int review, int block, int total) {
            if (total == 0) {
                return new DecisionRates(0, 0, 0);
            }
            return new DecisionRates(percent(allow, total), percent(review, total), percent(block, total));
        }

        public DecisionRates minus(DecisionRates other) {
            return new DecisionRates(round2(allow - other.allow), round2(review - other.review),
                    round2(block - other.block));
        }

        public double total() {
            return allow + review + block;
        }

        public double rate(Decision decision) {
            return switch (decision) {
                case ALLOW -> allow;
                case REVIEW -> review;
                case BLOCK -> block;
            };
        }

        public static double percent(int count, int total) {
            return total == 0 ? 0.0 : round2(count * 100.0 / total);
        }

        static double round2(double value) {
            return Math.round(value * 100.0) / 100.0;
        }
    }

    /**
     * A record whose outcome the rule would change. Carries no PII.
     */
    public record ChangeExample(
            @JsonProperty("txn_id") String id,
            @JsonProperty("amount") double amount,
            @JsonProperty("device") String device,
            @JsonProperty("baseline") Decision baseline,
            @JsonProperty("proposed") Decision proposed
    ) {
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static RiskLevel fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    /**
     * Estimate of how many newly caught transactions were legitimate.
     *
     * @param level          coarse tier
     * @param unflaggedCaught newly caught records with neither a flag nor a dispute
     * @param totalCaught    records moved from allow to review or block
     * @param estimatedRate  {@code unflaggedCaught / totalCaught} in percent
     * @param warning        explanation shown to reviewers, null when low
     */
    public record FalsePositiveRisk(
            @JsonProperty("level") RiskLevel level,
            @JsonProperty("unflagged_caught") int unflaggedCaught,
            @JsonProperty("total_caught") int totalCaught,
            @JsonProperty("fp_rate_estimate") double estimatedRate,
            @JsonProperty("warning") String warning
    ) {
    }
}
