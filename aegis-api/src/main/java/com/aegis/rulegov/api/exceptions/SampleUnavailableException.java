/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.exceptions;

/**
 * Impact could not be computed: the record store is unreachable or returned nothing.
 */
public class SampleUnavailableException extends RuleGovernanceException {

    public SampleUnavailableException(String message) {
        super("SAMPLE_UNAVAILABLE", message);
    }

    public SampleUnavailableException(String message, Throwable cause) {
        super("SAMPLE_UNAVAILABLE", message, cause);
    }
}
