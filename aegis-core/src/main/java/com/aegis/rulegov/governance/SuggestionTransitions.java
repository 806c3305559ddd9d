/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.governance;

import com.aegis.rulegov.api.exceptions.GovernanceViolationException;
import com.aegis.rulegov.api.exceptions.GovernanceViolationException.Reason;
import com.aegis.rulegov.api.model.Suggestion;

import java.time.Instant;

/**
 * Transition rules of the suggestion state machine.
 *
 * <pre>
 * pending --approve--&gt; approved
 * pending --reject---&gt; rejected
 * pending --expire---&gt; expired
 * </pre>
 *
 * <p>Pure functions over {@link Suggestion}: they check the preconditions and return the next
 * state, or throw {@link GovernanceViolationException}. Persisting the result (guarded on the
 * stored status still being pending) is the caller's job.
 */
public class SuggestionTransitions {

    private final GovernanceSettings settings;

    public SuggestionTransitions(GovernanceSettings settings) {
        this.settings = settings;
    }

    public Instant expiryFor(Instant createdAt) {
        return createdAt.plus(settings.suggestionTtl());
    }

    /**
     * Checks the two-person rule and the approval evidence.
     *
     * @param expectedImpact optional statement of the expected effect; checked for length when present
     */
    public Suggestion approve(Suggestion suggestion, String approverId, String notes, String expectedImpact,
                              boolean acknowledgeImpact, Instant now) {
        requirePending(suggestion, now);
        if (isBlank(approverId)) {
            throw new GovernanceViolationException(Reason.MISSING_REVIEWER, "Approver is required");
        }
        String approver = approverId.trim();
        String author = suggestion.author() == null ? null : suggestion.author().trim();
        if (approver.equals(author)) {
            throw new GovernanceViolationException(Reason.SELF_APPROVAL,
                    "Two-person rule: the author of a suggestion cannot approve it");
        }
        requireNotes(notes, "Approval notes");
        if (expectedImpact != null && expectedImpact.trim().length() < settings.minNotesLength()) {
            throw new GovernanceViolationException(Reason.EXPECTED_IMPACT_TOO_SHORT,
                    "Expected impact must be at least " + settings.minNotesLength() + " characters");
        }
        if (!acknowledgeImpact) {
            throw new GovernanceViolationException(Reason.IMPACT_NOT_ACKNOWLEDGED,
                    "Approver must acknowledge the impact report");
        }
        if (suggestion.validation() == null || !suggestion.validation().valid()) {
            throw new GovernanceViolationException(Reason.INVALID_RULE,
                    "Suggestion does not carry a valid validation result");
        }
        if (!suggestion.impactComputed()) {
            throw new GovernanceViolationException(Reason.IMPACT_NOT_COMPUTED,
                    "Impact could not be computed for this suggestion; run a dry run before approving");
        }
        return suggestion.approved(approver, notes.trim(),
                expectedImpact == null ? null : expectedImpact.trim(), now);
    }

    public Suggestion reject(Suggestion suggestion, String reviewerId, String notes, Instant now) {
        requireNotTerminal(suggestion);
        if (isBlank(reviewerId)) {
            throw new GovernanceViolationException(Reason.MISSING_REVIEWER, "Reviewer is required");
        }
        requireNotes(notes, "Rejection notes");
        return suggestion.rejected(reviewerId.trim(), notes.trim(), now);
    }

    public Suggestion expire(Suggestion suggestion, Instant now) {
        requireNotTerminal(suggestion);
        if (!suggestion.isOverdue(now)) {
            throw new IllegalArgumentException("Suggestion " + suggestion.id() + " is not overdue");
        }
        return suggestion.expired(now);
    }

    private void requirePending(Suggestion suggestion, Instant now) {
        requireNotTerminal(suggestion);
        if (suggestion.isOverdue(now)) {
            throw new GovernanceViolationException(Reason.EXPIRED,
                    "Suggestion expired at " + suggestion.expiresAt());
        }
    }

    private static void requireNotTerminal(Suggestion suggestion) {
        if (suggestion.status().isTerminal()) {
            throw new GovernanceViolationException(Reason.ALREADY_TERMINAL,
                    "Suggestion is already " + suggestion.status().wire());
        }
    }

    private void requireNotes(String notes, String label) {
        if (notes == null || notes.trim().length() < settings.minNotesLength()) {
            throw new GovernanceViolationException(Reason.NOTES_TOO_SHORT,
                    label + " must be at least " + settings.minNotesLength() + " characters");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
