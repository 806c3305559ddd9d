/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.analysis;

import com.aegis.rulegov.api.model.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sampled record matched by both a proposed and an active rule.
 */
public record OverlapExample(
        @JsonProperty("txn_id") String id,
        @JsonProperty("amount") double amount,
        @JsonProperty("device") String device,
        @JsonProperty("proposed_decision") Decision proposedDecision,
        @JsonProperty("existing_decision") Decision existingDecision
) {
    @JsonProperty("same_decision")
    public boolean sameDecision() {
        return proposedDecision == existingDecision;
    }
}
