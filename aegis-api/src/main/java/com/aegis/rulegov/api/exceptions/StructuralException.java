/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

import com.aegis.rulegov.api.model.ValidationError;

import java.util.List;

/**
 * The rule's shape is wrong: missing members, bad name, bad decision, condition count.
 */
public class StructuralException extends RuleRejectedException {

    public StructuralException(List<ValidationError> errors) {
        super("STRUCTURAL", "Rule structure is invalid", errors);
    }
}
