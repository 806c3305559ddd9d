/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * Caller input is unusable before any pipeline stage runs, e.g. a blank instruction.
 */
public class InvalidRequestException extends RuleGovernanceException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
