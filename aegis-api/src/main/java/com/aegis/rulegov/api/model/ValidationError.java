/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A validation finding pinned to a location in the rule, e.g. {@code conditions[2].value}.
 */
public record ValidationError(
        @JsonProperty("path") String path,
        @JsonProperty("message") String message
) {
    public static ValidationError at(String path, String message) {
        return new ValidationError(path, message);
    }

    @Override
    public String toString() {
        return path == null || path.isEmpty() ? message : path + ": " + message;
    }
}
