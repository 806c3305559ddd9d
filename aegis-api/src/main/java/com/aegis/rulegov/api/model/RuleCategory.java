/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import java.util.Optional;

/**
 * Coarse grouping of fraud rules used for reporting.
 */
public enum RuleCategory {
    HIGH_RISK("high_risk"),
    VALIDATION("validation"),
    VELOCITY("velocity"),
    BEHAVIORAL("behavioral"),
    COMPLIANCE("compliance");

    private final String wire;

    RuleCategory(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<RuleCategory> fromWire(String value) {
        for (RuleCategory category : values()) {
            if (category.wire.equals(value)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
