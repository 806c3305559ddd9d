/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Outcome a rule assigns to a matching transaction.
 *
 * <p>Decisions are ordered by severity: {@code block > review > allow}. When several
 * decisions apply to the same transaction the most severe one wins.
 */
public enum Decision {
    ALLOW("allow", 0),
    REVIEW("review", 1),
    BLOCK("block", 2);

    private final String wire;
    private final int severity;

    Decision(String wire, int severity) {
        this.wire = wire;
        this.severity = severity;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public int severity() {
        return severity;
    }

    /**
     * Returns the more severe of two decisions.
     */
    public static Decision mostSevere(Decision a, Decision b) {
        return a.severity >= b.severity ? a : b;
    }

    public static Optional<Decision> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Decision decision : values()) {
            if (decision.wire.equals(value)) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Decision parse(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("Unknown decision: " + value));
    }
}
