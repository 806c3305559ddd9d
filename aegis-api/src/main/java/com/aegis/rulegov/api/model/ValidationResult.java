/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation pass. A result is valid exactly when it carries no errors.
 */
public record ValidationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("errors") List<ValidationError> errors,
        @JsonProperty("warnings") List<ValidationError> warnings
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A valid result cannot carry errors");
        }
    }

    public static ValidationResult of(List<ValidationError> errors, List<ValidationError> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public ValidationResult merge(ValidationResult other) {
        List<ValidationError> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        List<ValidationError> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return of(mergedErrors, mergedWarnings);
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationError::toString).toList();
    }
}
