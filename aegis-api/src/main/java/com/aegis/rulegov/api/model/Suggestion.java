/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A generated rule awaiting, or past, human review.
 *
 * <p>Instances are immutable; transitions return a new instance. Once the status is terminal
 * the suggestion never changes again.
 */
public record Suggestion(
        @JsonProperty("id") String id,
        @JsonProperty("status") SuggestionStatus status,
        @JsonProperty("instruction") String instruction,
        @JsonProperty("rule") Rule rule,
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("violations") List<Violation> violations,
        @JsonProperty("impact") ImpactReport impact,
        @JsonProperty("impact_error") String impactError,
        @JsonProperty("overlaps") List<OverlapEntry> overlaps,
        @JsonProperty("generation") GenerationMetadata generation,
        @JsonProperty("created_by") String author,
        @JsonProperty("reviewed_by") String reviewer,
        @JsonProperty("review_notes") String reviewNotes,
        @JsonProperty("expected_impact") String expectedImpact,
        @JsonProperty("impact_acknowledged") boolean impactAcknowledged,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("reviewed_at") Instant reviewedAt,
        @JsonProperty("expires_at") Instant expiresAt
) {
    public Suggestion {
        violations = violations == null ? List.of() : List.copyOf(violations);
        overlaps = overlaps == null ? List.of() : List.copyOf(overlaps);
    }

    /**
     * Builds a fresh pending suggestion.
     */
    public static Suggestion pending(String id, String instruction, Rule rule, ValidationResult validation,
                                     List<Violation> violations, ImpactReport impact, String impactError,
                                     List<OverlapEntry> overlaps, GenerationMetadata generation,
                                     String author, Instant createdAt, Instant expiresAt) {
        return new Suggestion(id, SuggestionStatus.PENDING, instruction, rule, validation, violations,
                impact, impactError, overlaps, generation, author, null, null, null, false,
                createdAt, null, expiresAt);
    }

    public Suggestion approved(String approver, String notes, String expectedImpact, Instant at) {
        return new Suggestion(id, SuggestionStatus.APPROVED, instruction, rule, validation, violations,
                impact, impactError, overlaps, generation, author, approver, notes, expectedImpact, true,
                createdAt, at, expiresAt);
    }

    public Suggestion rejected(String reviewer, String notes, Instant at) {
        return new Suggestion(id, SuggestionStatus.REJECTED, instruction, rule, validation, violations,
                impact, impactError, overlaps, generation, author, reviewer, notes, null, false,
                createdAt, at, expiresAt);
    }

    public Suggestion expired(Instant at) {
        return new Suggestion(id, SuggestionStatus.EXPIRED, instruction, rule, validation, violations,
                impact, impactError, overlaps, generation, author, null, null, null, false,
                createdAt, at, expiresAt);
    }

    @JsonIgnore
    public boolean impactComputed() {
        return impact != null;
    }

    @JsonIgnore
    public boolean isOverdue(Instant now) {
        return status == SuggestionStatus.PENDING && expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * {@code ready} when nothing needs a reviewer's attention, otherwise {@code has_warnings}.
     */
    @JsonProperty("readiness")
    public String readiness() {
        boolean warnings = !violations.isEmpty()
                || (validation != null && !validation.warnings().isEmpty());
        return warnings ? "has_warnings" : "ready";
    }
}
