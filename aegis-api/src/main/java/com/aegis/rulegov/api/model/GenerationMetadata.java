/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance of a generated rule.
 */
public record GenerationMetadata(
        @JsonProperty("model") String model,
        @JsonProperty("prompt_hash") String promptHash,
        @JsonProperty("cached") boolean cached,
        @JsonProperty("latency_ms") long latencyMillis,
        @JsonProperty("total_tokens") int totalTokens
) {
    public GenerationMetadata asCached() {
        return new GenerationMetadata(model, promptHash, true, 0L, 0);
    }
}
