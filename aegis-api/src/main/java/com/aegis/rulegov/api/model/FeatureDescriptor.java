/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Describes one field that rule conditions may reference.
 *
 * @param name        field name as it appears in transaction records
 * @param type        semantic type
 * @param min         inclusive lower bound for numeric fields, or null
 * @param max         inclusive upper bound for numeric fields, or null
 * @param values      allowed values for enum fields
 * @param maxLength   maximum length for string fields, or null
 * @param nullable    whether a null comparison value is acceptable
 * @param pii         whether the field carries personally identifying data
 * @param description human readable description, also fed to the generator prompt
 */
public record FeatureDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("type") FeatureType type,
        @JsonProperty("min") Double min,
        @JsonProperty("max") Double max,
        @JsonProperty("values") List<String> values,
        @JsonProperty("max_length") Integer maxLength,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("pii") boolean pii,
        @JsonProperty("description") String description
) {
    public FeatureDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Feature name cannot be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Feature type is required for " + name);
        }
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean hasRange() {
        return min != null || max != null;
    }
}
