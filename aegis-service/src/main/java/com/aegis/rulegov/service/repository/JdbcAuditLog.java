/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.AuditLog;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.model.AuditEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.aegis.rulegov.service.repository.JdbcSupport.fromJson;
import static com.aegis.rulegov.service.repository.JdbcSupport.getInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.setInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.sql;
import static com.aegis.rulegov.service.repository.JdbcSupport.toJson;

/**
 * Append-only audit table. There is no update or delete statement for it.
 */
@ApplicationScoped
public class JdbcAuditLog implements AuditLog {

    private static final Logger logger = Logger.getLogger(JdbcAuditLog.class.getName());

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    @Inject
    DataSource dataSource;

    @Override
    public void append(AuditEntry entry) {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, entry);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to append audit entry: " + entry.action().wire(), e);
            throw new PersistenceException("Failed to append audit entry", e);
        }
    }

    /**
     * Inserts the entry on the caller's connection so it commits or rolls back with the
     * caller's transaction.
     */
    static void insert(Connection conn, AuditEntry entry) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql("insert_audit"))) {
            int idx = 1;
            stmt.setString(idx++, entry.id());
            stmt.setString(idx++, entry.actor());
            stmt.setString(idx++, entry.action().wire());
            stmt.setString(idx++, entry.resourceType());
            stmt.setString(idx++, entry.resourceId());
            stmt.setString(idx++, toJson(entry.payload()));
            stmt.setBoolean(idx++, entry.success());
            stmt.setString(idx++, entry.errorMessage());
            setInstant(stmt, idx, entry.timestamp());
            stmt.executeUpdate();
        }
    }

    @Override
    public List<AuditEntry> findByResource(String resourceId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_audits_by_resource"))) {
            stmt.setString(1, resourceId);
            return readAll(stmt);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to read audit trail of " + resourceId, e);
            throw new PersistenceException("Failed to read audit trail", e);
        }
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_recent_audits"))) {
            stmt.setInt(1, limit);
            return readAll(stmt);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to read recent audit entries", e);
            throw new PersistenceException("Failed to read audit trail", e);
        }
    }

    private static List<AuditEntry> readAll(PreparedStatement stmt) throws SQLException {
        List<AuditEntry> entries = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                entries.add(new AuditEntry(
                        rs.getString("id"),
                        rs.getString("actor"),
                        AuditEntry.Action.fromWire(rs.getString("action")),
                        rs.getString("resource_type"),
                        rs.getString("resource_id"),
                        rs.getBoolean("success"),
                        fromJson(rs.getString("payload_json"), PAYLOAD),
                        rs.getString("error_message"),
                        getInstant(rs, "created_at")));
            }
        }
        return entries;
    }
}
