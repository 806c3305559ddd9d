package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.SuggestionRepository;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory suggestion store for tests. Transitions are guarded on the stored status the same
 * way the SQL update is. The audit entry is appended before any state changes, so a failing
 * audit log leaves the store untouched like a rolled back transaction.
 */
public class InMemorySuggestionRepository implements SuggestionRepository {

    private final Map<String, Suggestion> suggestions = new LinkedHashMap<>();
    private final InMemoryActiveRuleRegistry registry;
    private final InMemoryAuditLog auditLog;

    public InMemorySuggestionRepository(InMemoryActiveRuleRegistry registry, InMemoryAuditLog auditLog) {
        this.registry = registry;
        this.auditLog = auditLog;
    }

    /**
     * Seeds a suggestion without an audit entry.
     */
    public synchronized void insert(Suggestion suggestion) {
        if (suggestions.putIfAbsent(suggestion.id(), suggestion) != null) {
            throw new IllegalStateException("Duplicate suggestion " + suggestion.id());
        }
    }

    @Override
    public synchronized void insert(Suggestion suggestion, AuditEntry audit) {
        if (suggestions.containsKey(suggestion.id())) {
            throw new IllegalStateException("Duplicate suggestion " + suggestion.id());
        }
        auditLog.append(audit);
        suggestions.put(suggestion.id(), suggestion);
    }

    @Override
    public synchronized Optional<Suggestion> findById(String id) {
        return Optional.ofNullable(suggestions.get(id));
    }

    @Override
    public synchronized List<Suggestion> find(SuggestionStatus status, String author, int limit, int offset) {
        return suggestions.values().stream()
                .filter(s -> status == null || s.status() == status)
                .filter(s -> author == null || author.equals(s.author()))
                .sorted(Comparator.comparing(Suggestion::createdAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean approve(Suggestion approved, ActiveRule promoted, RuleVersion version,
                                        AuditEntry audit) {
        if (!isPending(approved.id())) {
            return false;
        }
        auditLog.append(audit);
        suggestions.put(approved.id(), approved);
        registry.promote(promoted, version);
        return true;
    }

    @Override
    public synchronized boolean reject(Suggestion rejected, AuditEntry audit) {
        return replacePending(rejected, audit);
    }

    @Override
    public synchronized List<Suggestion> findOverdue(Instant now, int limit) {
        return suggestions.values().stream()
                .filter(s -> s.isOverdue(now))
                .sorted(Comparator.comparing(Suggestion::expiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean expire(Suggestion expired, AuditEntry audit) {
        return replacePending(expired, audit);
    }

    private boolean replacePending(Suggestion next, AuditEntry audit) {
        if (!isPending(next.id())) {
            return false;
        }
        auditLog.append(audit);
        suggestions.put(next.id(), next);
        return true;
    }

    private boolean isPending(String id) {
        Suggestion current = suggestions.get(id);
        return current != null && current.status() == SuggestionStatus.PENDING;
    }
}
