/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a suggestion. Only {@link #PENDING} can transition; the rest are terminal.
 */
public enum SuggestionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SuggestionStatus fromWire(String value) {
        return valueOf(value.toUpperCase());
    }
}
