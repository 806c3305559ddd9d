/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.governance;

import com.aegis.rulegov.api.AuditLog;
import com.aegis.rulegov.api.SuggestionRepository;
import com.aegis.rulegov.api.exceptions.GovernanceViolationException;
import com.aegis.rulegov.api.exceptions.GovernanceViolationException.Reason;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.exceptions.SuggestionNotFoundException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.AuditEntry.Action;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;
import com.aegis.rulegov.governance.SuggestionTransitions;
import com.aegis.rulegov.support.ContentHash;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies governance transitions to stored suggestions.
 *
 * <p>Preconditions are checked by {@link SuggestionTransitions}; the stored status guard in
 * {@link SuggestionRepository} decides races between concurrent reviewers. Every attempt,
 * successful or not, leaves an audit entry.
 */
@ApplicationScoped
public class GovernanceService {

    private static final Logger logger = Logger.getLogger(GovernanceService.class.getName());

    static final int EXPIRY_BATCH = 100;
    static final int MAX_PAGE = 200;

    @Inject
    Tracer tracer;

    @Inject
    SuggestionRepository repository;

    @Inject
    AuditLog auditLog;

    @Inject
    SuggestionTransitions transitions;

    @Inject
    Clock clock;

    public Suggestion approveSuggestion(String id, String approverId, String notes, boolean acknowledgeImpact) {
        return approveSuggestion(id, approverId, notes, acknowledgeImpact, null);
    }

    /**
     * Approves a pending suggestion and promotes its rule to the active set as version 1.
     *
     * @throws GovernanceViolationException when a precondition fails or another transition won
     */
    public Suggestion approveSuggestion(String id, String approverId, String notes, boolean acknowledgeImpact,
                                        String expectedImpact) {
        Span span = tracer.spanBuilder("approve-suggestion").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("suggestionId", id);
            Suggestion suggestion = findSuggestion(id);
            String actor = actorOrUnknown(approverId);
            Instant now = clock.instant();

            Suggestion approved;
            try {
                approved = transitions.approve(suggestion, approverId, notes, expectedImpact, acknowledgeImpact, now);
            } catch (GovernanceViolationException e) {
                Action action = e.reason() == Reason.SELF_APPROVAL
                        ? Action.APPLY_RULE_REJECTED_TWO_PERSON
                        : Action.APPLY_RULE_REJECTED;
                refused(actor, action, suggestion, e);
                throw e;
            }

            String ruleId = UUID.randomUUID().toString();
            String fingerprint = ContentHash.fingerprint(approved.rule());
            ActiveRule promoted = new ActiveRule(ruleId, approved.rule(), 1, approved.author(), actor, now, true);
            RuleVersion version = RuleVersion.fromApproval(UUID.randomUUID().toString(), ruleId, approved, fingerprint);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("rule_id", ruleId);
            payload.put("rule_name", approved.rule().name());
            payload.put("version", version.version());
            payload.put("rule_fingerprint", fingerprint);
            payload.put("author", approved.author());
            payload.put("expected_impact", approved.expectedImpact());
            AuditEntry audit = AuditEntry.success(UUID.randomUUID().toString(), actor, Action.APPLY_RULE,
                    "suggestion", id, payload, now);

            if (!repository.approve(approved, promoted, version, audit)) {
                GovernanceViolationException lost = new GovernanceViolationException(Reason.CONCURRENT_TRANSITION,
                        "Suggestion " + id + " was transitioned concurrently");
                refused(actor, Action.APPLY_RULE_REJECTED, suggestion, lost);
                throw lost;
            }

            logger.info("Suggestion " + id + " approved by " + actor + ", rule " + ruleId + " is active");
            return approved;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    public Suggestion rejectSuggestion(String id, String reviewerId, String notes) {
        Span span = tracer.spanBuilder("reject-suggestion").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("suggestionId", id);
            Suggestion suggestion = findSuggestion(id);
            String actor = actorOrUnknown(reviewerId);
            Instant now = clock.instant();

            Suggestion rejected;
            try {
                rejected = transitions.reject(suggestion, reviewerId, notes, now);
            } catch (GovernanceViolationException e) {
                refused(actor, Action.REJECT_RULE_FAILED, suggestion, e);
                throw e;
            }
            AuditEntry audit = AuditEntry.success(UUID.randomUUID().toString(), actor, Action.REJECT_RULE,
                    "suggestion", id, Map.of("notes", rejected.reviewNotes()), now);
            if (!repository.reject(rejected, audit)) {
                GovernanceViolationException lost = new GovernanceViolationException(Reason.CONCURRENT_TRANSITION,
                        "Suggestion " + id + " was transitioned concurrently");
                refused(actor, Action.REJECT_RULE_FAILED, suggestion, lost);
                throw lost;
            }

            logger.info("Suggestion " + id + " rejected by " + actor);
            return rejected;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Expires pending suggestions past their expiry time.
     *
     * @return number of suggestions expired by this call
     */
    public int expireDue() {
        Instant now = clock.instant();
        int expired = 0;
        for (Suggestion overdue : repository.findOverdue(now, EXPIRY_BATCH)) {
            Suggestion next = transitions.expire(overdue, now);
            AuditEntry audit = AuditEntry.success(UUID.randomUUID().toString(), "system", Action.EXPIRE_SUGGESTION,
                    "suggestion", overdue.id(), Map.of("expires_at", String.valueOf(overdue.expiresAt())), now);
            if (!repository.expire(next, audit)) {
                logger.fine(() -> "Suggestion " + overdue.id() + " left pending before it could expire");
                continue;
            }
            expired++;
        }
        if (expired > 0) {
            logger.info("Expired " + expired + " overdue suggestion(s)");
        }
        return expired;
    }

    public Suggestion findSuggestion(String id) {
        if (id == null || id.isBlank()) {
            throw new SuggestionNotFoundException(String.valueOf(id));
        }
        return repository.findById(id).orElseThrow(() -> new SuggestionNotFoundException(id));
    }

    public List<Suggestion> listSuggestions(SuggestionStatus status, String author, int limit, int offset) {
        if (limit <= 0 || limit > MAX_PAGE) {
            throw new InvalidRequestException("Limit must be between 1 and " + MAX_PAGE);
        }
        if (offset < 0) {
            throw new InvalidRequestException("Offset cannot be negative");
        }
        return repository.find(status, author, limit, offset);
    }

    public List<AuditEntry> auditTrail(String resourceId) {
        return auditLog.findByResource(resourceId);
    }

    private void refused(String actor, Action action, Suggestion suggestion, GovernanceViolationException e) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", e.reason().name());
        payload.put("status", suggestion.status().wire());
        payload.put("author", suggestion.author());
        logger.info("Transition of " + suggestion.id() + " refused for " + actor + ": " + e.reason());
        try {
            auditLog.append(AuditEntry.failure(UUID.randomUUID().toString(), actor, action, "suggestion",
                    suggestion.id(), payload, e.getMessage(), clock.instant()));
        } catch (PersistenceException auditFailure) {
            logger.log(Level.WARNING, "Could not record " + action.wire() + " audit entry", auditFailure);
            e.addSuppressed(auditFailure);
        }
    }

    private static String actorOrUnknown(String actor) {
        return actor == null || actor.isBlank() ? "unknown" : actor.trim();
    }
}
