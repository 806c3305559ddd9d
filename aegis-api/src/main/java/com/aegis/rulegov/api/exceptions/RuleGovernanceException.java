/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * Base class of all rule governance failures.
 *
 * <p>Unchecked so that the pipeline stages can propagate failures without forcing every
 * caller to declare them. Each subclass carries a stable error code for API clients.
 */
public class RuleGovernanceException extends RuntimeException {

    private final String errorCode;

    public RuleGovernanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RuleGovernanceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
