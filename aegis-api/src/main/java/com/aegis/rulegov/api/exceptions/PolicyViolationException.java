/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

import com.aegis.rulegov.api.model.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The instruction or the rule breaks governance policy.
 */
public class PolicyViolationException extends RuleGovernanceException {

    private final List<Violation> violations;

    public PolicyViolationException(List<Violation> violations) {
        super("POLICY_VIOLATION", "Policy violation: " + violations.stream()
                .filter(Violation::isBlocking)
                .map(Violation::message)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }
}
