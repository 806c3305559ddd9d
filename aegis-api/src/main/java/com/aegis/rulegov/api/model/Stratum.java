/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Population slices the sampler draws from.
 */
public enum Stratum {
    RECENT("recent"),
    WEEKEND_OFF_HOURS("weekend_off_hours"),
    FLAGGED_DISPUTED("flagged_disputed"),
    HIGH_VALUE("high_value"),
    RANDOM("random");

    private final String wire;

    Stratum(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
