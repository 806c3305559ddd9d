/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.AuditEntry;

import java.util.List;

/**
 * Append-only audit trail.
 */
public interface AuditLog {

    void append(AuditEntry entry);

    /** Entries for one resource, oldest first. */
    List<AuditEntry> findByResource(String resourceId);

    /** Most recent entries, newest first. */
    List<AuditEntry> findRecent(int limit);
}
