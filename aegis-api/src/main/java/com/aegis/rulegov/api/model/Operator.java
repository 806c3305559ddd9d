/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Comparison operators a condition may use.
 *
 * <p>Which operators are legal for a field is decided by the feature catalog, based on the
 * field's semantic type.
 */
public enum Operator {
    EQUAL_TO("=="),
    NOT_EQUAL_TO("!="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    IS_ANY_OF("in"),
    IS_NONE_OF("not_in"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** Ordering comparison, only meaningful for numeric values. */
    public boolean isOrdering() {
        return this == GREATER_THAN || this == LESS_THAN
                || this == GREATER_THAN_OR_EQUAL || this == LESS_THAN_OR_EQUAL;
    }

    /** Set membership; the condition value must be a list. */
    public boolean isMembership() {
        return this == IS_ANY_OF || this == IS_NONE_OF;
    }

    public boolean isContainment() {
        return this == CONTAINS || this == NOT_CONTAINS;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
