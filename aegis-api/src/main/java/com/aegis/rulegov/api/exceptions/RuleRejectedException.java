/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

import com.aegis.rulegov.api.model.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A generated rule failed validation. Carries every finding, not just the first.
 */
public abstract class RuleRejectedException extends RuleGovernanceException {

    private final List<ValidationError> errors;

    protected RuleRejectedException(String errorCode, String summary, List<ValidationError> errors) {
        super(errorCode, summary + ": " + errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }
}
