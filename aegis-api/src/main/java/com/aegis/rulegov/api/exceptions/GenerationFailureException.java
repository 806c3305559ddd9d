/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * The generation collaborator did not produce a usable rule. Never retried automatically.
 */
public class GenerationFailureException extends RuleGovernanceException {

    public enum Reason {
        TIMEOUT,
        MALFORMED_OUTPUT,
        RATE_LIMITED,
        UPSTREAM_ERROR
    }

    private final Reason reason;
    private final String promptHash;

    public GenerationFailureException(Reason reason, String promptHash, String message) {
        super("GENERATION_" + reason.name(), message);
        this.reason = reason;
        this.promptHash = promptHash;
    }

    public GenerationFailureException(Reason reason, String promptHash, String message, Throwable cause) {
        super("GENERATION_" + reason.name(), message, cause);
        this.reason = reason;
        this.promptHash = promptHash;
    }

    public Reason reason() {
        return reason;
    }

    /** Content hash of the prompt, safe to log. May be null. */
    public String promptHash() {
        return promptHash;
    }
}
