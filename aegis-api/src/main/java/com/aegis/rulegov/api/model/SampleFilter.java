/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Optional narrowing applied to every stratum query. Null members do not filter.
 */
public record SampleFilter(
        @JsonProperty("device") String device,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("partner") String partner,
        @JsonProperty("date_from") Instant from,
        @JsonProperty("date_to") Instant to
) {
    private static final SampleFilter NONE = new SampleFilter(null, null, null, null, null);

    public static SampleFilter none() {
        return NONE;
    }

    public boolean matches(TransactionRecord record) {
        if (device != null && !device.equals(record.feature("device"))) {
            return false;
        }
        if (agentId != null && !agentId.equals(record.feature("agent_id"))) {
            return false;
        }
        if (partner != null && !partner.equals(record.feature("partner"))) {
            return false;
        }
        if (from != null && record.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || !record.timestamp().isAfter(to);
    }
}
