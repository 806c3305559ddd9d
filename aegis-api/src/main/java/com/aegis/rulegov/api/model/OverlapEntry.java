/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Similarity between a proposed rule and one active rule on a shared sample.
 *
 * @param ruleId            active rule id
 * @param ruleName          active rule name
 * @param score             Jaccard index of the two match sets, in [0, 1], four decimals
 * @param intersectionCount records matched by both rules
 * @param proposedMatches   records matched by the proposed rule
 * @param existingMatches   records matched by the active rule
 * @param tier              interpretation of the score
 * @param warning           merge hint for high overlap, otherwise null
 */
public record OverlapEntry(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("score") double score,
        @JsonProperty("intersection_count") int intersectionCount,
        @JsonProperty("proposed_matches") int proposedMatches,
        @JsonProperty("existing_matches") int existingMatches,
        @JsonProperty("tier") Tier tier,
        @JsonProperty("warning") String warning
) {

    public enum Tier {
        VERY_HIGH(0.8, "Very high overlap - likely redundant"),
        HIGH(0.5, "High overlap - consider merging"),
        MODERATE(0.3, "Moderate overlap"),
        LOW(0.1, "Low overlap"),
        MINIMAL(0.0, "Minimal overlap");

        private final double floor;
        private final String description;

        Tier(double floor, String description) {
            this.floor = floor;
            this.description = description;
        }

        public String description() {
            return description;
        }

        /** Tiers use strict lower bounds: 0.8 itself is HIGH. */
        public static Tier of(double score) {
            for (Tier tier : values()) {
                if (tier != MINIMAL && score > tier.floor) {
                    return tier;
                }
            }
            return MINIMAL;
        }

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Tier fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }
}
