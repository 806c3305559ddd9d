/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.support;

import com.aegis.rulegov.api.json.RuleJson;
import com.aegis.rulegov.api.model.Rule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * SHA-256 content hashes for prompts and rules.
 */
public final class ContentHash {

    private static final ObjectMapper CANONICAL = RuleJson.mapper().copy()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ContentHash() {
    }

    public static String sha256(String content) {
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }

    /**
     * Fingerprint of a rule's canonical JSON form. Two rules with the same members have the
     * same fingerprint.
     */
    public static String fingerprint(Rule rule) {
        try {
            return sha256(CANONICAL.writeValueAsString(rule));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Rule cannot be serialized for fingerprinting", e);
        }
    }
}
