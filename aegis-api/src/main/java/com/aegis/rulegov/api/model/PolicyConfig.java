/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Governance policy loaded together with the feature catalog.
 *
 * @param disallowedFields  fields that must never appear in a rule
 * @param piiFields         fields that are permitted but raise a warning
 * @param maxConditions     upper bound on leaf conditions per rule
 * @param sensitivePatterns case-insensitive regular expressions scanned in instructions
 * @param categories        accepted rule categories
 */
public record PolicyConfig(
        @JsonProperty("disallowed_fields") Set<String> disallowedFields,
        @JsonProperty("pii_fields") Set<String> piiFields,
        @JsonProperty("max_conditions_per_rule") int maxConditions,
        @JsonProperty("sensitive_patterns") List<String> sensitivePatterns,
        @JsonProperty("categories") List<String> categories
) {
    public PolicyConfig {
        disallowedFields = disallowedFields == null ? Set.of() : Set.copyOf(disallowedFields);
        piiFields = piiFields == null ? Set.of() : Set.copyOf(piiFields);
        sensitivePatterns = sensitivePatterns == null ? List.of() : List.copyOf(sensitivePatterns);
        categories = categories == null ? List.of() : List.copyOf(categories);
        if (maxConditions <= 0) {
            throw new IllegalArgumentException("max_conditions_per_rule must be positive");
        }
    }
}
