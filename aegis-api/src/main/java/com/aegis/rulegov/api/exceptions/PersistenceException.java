/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * A storage operation failed. Wraps the underlying driver exception.
 */
public class PersistenceException extends RuleGovernanceException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE", message, cause);
    }
}
