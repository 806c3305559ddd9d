/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * A suggestion transition was refused.
 */
public class GovernanceViolationException extends RuleGovernanceException {

    public enum Reason {
        MISSING_REVIEWER,
        SELF_APPROVAL,
        NOTES_TOO_SHORT,
        EXPECTED_IMPACT_TOO_SHORT,
        IMPACT_NOT_ACKNOWLEDGED,
        INVALID_RULE,
        IMPACT_NOT_COMPUTED,
        ALREADY_TERMINAL,
        EXPIRED,
        CONCURRENT_TRANSITION
    }

    private final Reason reason;

    public GovernanceViolationException(Reason reason, String message) {
        super(reason.name(), message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
