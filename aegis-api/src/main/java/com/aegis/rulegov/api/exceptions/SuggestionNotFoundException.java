/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

public class SuggestionNotFoundException extends RuleGovernanceException {

    public SuggestionNotFoundException(String suggestionId) {
        super("NOT_FOUND", "Suggestion not found: " + suggestionId);
    }
}
