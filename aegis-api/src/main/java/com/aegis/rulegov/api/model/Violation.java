/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A policy finding produced by the policy gate.
 *
 * @param type       kind of finding
 * @param severity   errors block the pipeline, warnings travel with the suggestion
 * @param message    human readable explanation
 * @param field      offending field, null for instruction-level findings
 * @param suggestion how the author can fix it, may be null
 */
public record Violation(
        @JsonProperty("type") Type type,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("message") String message,
        @JsonProperty("field") String field,
        @JsonProperty("suggestion") String suggestion
) {

    public enum Type {
        SENSITIVE_LANGUAGE,
        DISALLOWED_FIELD,
        PII_FIELD,
        BROAD_NEGATION;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Type fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    public enum Severity {
        ERROR,
        WARNING;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Severity fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    public boolean isBlocking() {
        return severity == Severity.ERROR;
    }

    public static Violation error(Type type, String field, String message, String suggestion) {
        return new Violation(type, Severity.ERROR, message, field, suggestion);
    }

    public static Violation warning(Type type, String field, String message, String suggestion) {
        return new Violation(type, Severity.WARNING, message, field, suggestion);
    }
}
