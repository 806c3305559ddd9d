/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A rule in the live rule set.
 */
public record ActiveRule(
        @JsonProperty("id") String id,
        @JsonProperty("rule") Rule rule,
        @JsonProperty("version") int version,
        @JsonProperty("created_by") String author,
        @JsonProperty("approved_by") String approvedBy,
        @JsonProperty("activated_at") Instant activatedAt,
        @JsonProperty("enabled") boolean enabled
) {
    public String name() {
        return rule.name();
    }
}
