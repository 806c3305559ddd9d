/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A historical transaction as seen by the simulator.
 *
 * <p>Features are keyed by catalog field name and hold {@link Number}, {@link String},
 * {@link Boolean} or null. Records are read-only.
 *
 * @param id        unique transaction id
 * @param timestamp when the transaction happened
 * @param decision  decision the active rule set produced, null is treated as allow
 * @param features  feature values by field name
 */
public record TransactionRecord(
        @JsonProperty("txn_id") String id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("decision") Decision decision,
        @JsonProperty("features") Map<String, Object> features
) {
    public TransactionRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Transaction id cannot be blank");
        }
        // HashMap copy: feature values may legitimately be null
        features = features == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(features));
    }

    public Decision baselineDecision() {
        return decision == null ? Decision.ALLOW : decision;
    }

    public Object feature(String name) {
        return features.get(name);
    }

    public double amount() {
        return features.get("amount") instanceof Number n ? n.doubleValue() : 0.0;
    }

    public boolean flag(String name) {
        return Boolean.TRUE.equals(features.get(name));
    }

    /** True when the transaction carries a fraud flag or a dispute. */
    public boolean isFlaggedOrDisputed() {
        return flag("flagged") || flag("disputed");
    }
}
