package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.AuditLog;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.model.AuditEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory audit trail for tests.
 */
public class InMemoryAuditLog implements AuditLog {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void append(AuditEntry entry) {
        if (failing) {
            throw new PersistenceException("Audit store unavailable",
                    new IllegalStateException("append refused for " + entry.action()));
        }
        entries.add(entry);
    }

    /**
     * Makes every following append throw until switched back.
     */
    public void failAppends(boolean failing) {
        this.failing = failing;
    }

    @Override
    public List<AuditEntry> findByResource(String resourceId) {
        return entries.stream().filter(e -> resourceId.equals(e.resourceId())).toList();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> recent = new ArrayList<>(entries);
        Collections.reverse(recent);
        return recent.stream().limit(limit).toList();
    }

    public List<AuditEntry> all() {
        return List.copyOf(entries);
    }

    public List<AuditEntry.Action> actions() {
        return entries.stream().map(AuditEntry::action).toList();
    }
}
