/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for suggestions.
 *
 * <p>Every transition method is guarded on the stored status being {@code pending} and
 * returns {@code false} when the guard fails, i.e. another transition won the race.
 *
 * <p>Each write also records the given audit entry in the same transaction. When the audit
 * cannot be written nothing is committed; a failed guard writes no audit entry.
 */
public interface SuggestionRepository {

    void insert(Suggestion suggestion, AuditEntry audit);

    Optional<Suggestion> findById(String id);

    /**
     * @param status filter, or null for any
     * @param author filter, or null for any
     */
    List<Suggestion> find(SuggestionStatus status, String author, int limit, int offset);

    /**
     * Atomically marks the suggestion approved, promotes its rule into the active set and
     * appends the version record.
     */
    boolean approve(Suggestion approved, ActiveRule promoted, RuleVersion version, AuditEntry audit);

    boolean reject(Suggestion rejected, AuditEntry audit);

    /**
     * Pending suggestions whose expiry is at or before {@code now}.
     */
    List<Suggestion> findOverdue(Instant now, int limit);

    boolean expire(Suggestion expired, AuditEntry audit);
}
