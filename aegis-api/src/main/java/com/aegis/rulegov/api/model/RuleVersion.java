/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Append-only history entry for an active rule.
 *
 * <p>Captures the exact rule that went live together with the evidence the approver saw,
 * so that any activation can be traced back to its impact report.
 */
public record RuleVersion(
        @JsonProperty("id") String id,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("version") int version,
        @JsonProperty("change_type") ChangeType changeType,
        @JsonProperty("rule") Rule rule,
        @JsonProperty("rule_fingerprint") String fingerprint,
        @JsonProperty("created_by") String author,
        @JsonProperty("approved_by") String approvedBy,
        @JsonProperty("approval_notes") String approvalNotes,
        @JsonProperty("expected_impact") String expectedImpact,
        @JsonProperty("suggestion_id") String suggestionId,
        @JsonProperty("impact") ImpactReport impact,
        @JsonProperty("overlaps") List<OverlapEntry> overlaps,
        @JsonProperty("created_at") Instant createdAt
) {

    /**
     * Type of change that created this version.
     */
    public enum ChangeType {
        CREATED,
        UPDATED,
        DISABLED
    }

    public RuleVersion {
        overlaps = overlaps == null ? List.of() : List.copyOf(overlaps);
    }

    /**
     * Creates the first version of a rule promoted from an approved suggestion.
     */
    public static RuleVersion fromApproval(String id, String ruleId, Suggestion approved, String fingerprint) {
        return new RuleVersion(
                id,
                ruleId,
                1,
                ChangeType.CREATED,
                approved.rule(),
                fingerprint,
                approved.author(),
                approved.reviewer(),
                approved.reviewNotes(),
                approved.expectedImpact(),
                approved.id(),
                approved.impact(),
                approved.overlaps(),
                approved.reviewedAt()
        );
    }
}
