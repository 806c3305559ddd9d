/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only record of a governance-relevant action.
 */
public record AuditEntry(
        @JsonProperty("id") String id,
        @JsonProperty("actor") String actor,
        @JsonProperty("action") Action action,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("success") boolean success,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant timestamp
) {

    public enum Action {
        SUGGEST_RULE,
        SUGGEST_RULE_REJECTED,
        GENERATION_FAILED,
        DRY_RUN,
        APPLY_RULE,
        APPLY_RULE_REJECTED_TWO_PERSON,
        APPLY_RULE_REJECTED,
        REJECT_RULE,
        REJECT_RULE_FAILED,
        EXPIRE_SUGGESTION;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Action fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    public AuditEntry {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AuditEntry success(String id, String actor, Action action, String resourceType,
                                     String resourceId, Map<String, Object> payload, Instant at) {
        return new AuditEntry(id, actor, action, resourceType, resourceId, true, payload, null, at);
    }

    public static AuditEntry failure(String id, String actor, Action action, String resourceType,
                                     String resourceId, Map<String, Object> payload, String error, Instant at) {
        return new AuditEntry(id, actor, action, resourceType, resourceId, false, payload, error, at);
    }
}
