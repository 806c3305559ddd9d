/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

import com.aegis.rulegov.api.model.ValidationError;

import java.util.List;

/**
 * The rule references unknown fields or uses operators and values the catalog does not allow.
 */
public class CatalogViolationException extends RuleRejectedException {

    public CatalogViolationException(List<ValidationError> errors) {
        super("CATALOG_VIOLATION", "Rule does not conform to the feature catalog", errors);
    }
}
