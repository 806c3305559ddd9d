/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.SuggestionRepository;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.OverlapEntry;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.api.model.Violation;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.aegis.rulegov.service.repository.JdbcSupport.fromJson;
import static com.aegis.rulegov.service.repository.JdbcSupport.getBooleanOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.getInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.getIntegerOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.setInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.sql;
import static com.aegis.rulegov.service.repository.JdbcSupport.toJson;

/**
 * JDBC implementation of {@link SuggestionRepository} for H2 or PostgreSQL.
 *
 * <p>Transitions are single {@code UPDATE ... WHERE id = ? AND status = 'pending'} statements;
 * an update count of zero means another transition already happened. Every write commits
 * together with its audit row; approval adds the rule promotion and the version insert to the
 * same transaction.
 */
@ApplicationScoped
public class JdbcSuggestionRepository implements SuggestionRepository {

    private static final Logger logger = Logger.getLogger(JdbcSuggestionRepository.class.getName());

    private static final TypeReference<List<Violation>> VIOLATIONS = new TypeReference<>() {
    };
    private static final TypeReference<List<OverlapEntry>> OVERLAPS = new TypeReference<>() {
    };

    @Inject
    DataSource dataSource;

    @Override
    public void insert(Suggestion suggestion, AuditEntry audit) {
        try {
            inTransaction(conn -> {
                insertSuggestion(conn, suggestion);
                JdbcAuditLog.insert(conn, audit);
                return true;
            });
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to insert suggestion: " + suggestion.id(), e);
            throw new PersistenceException("Failed to insert suggestion", e);
        }
    }

    private static void insertSuggestion(Connection conn, Suggestion suggestion) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql("insert_suggestion"))) {
            GenerationMetadata generation = suggestion.generation();
            int idx = 1;
            stmt.setString(idx++, suggestion.id());
            stmt.setString(idx++, suggestion.status().wire());
            stmt.setString(idx++, suggestion.instruction());
            stmt.setString(idx++, toJson(suggestion.rule()));
            stmt.setString(idx++, toJson(suggestion.validation()));
            stmt.setString(idx++, toJson(suggestion.violations()));
            stmt.setString(idx++, toJson(suggestion.impact()));
            stmt.setString(idx++, suggestion.impactError());
            stmt.setString(idx++, toJson(suggestion.overlaps()));
            if (generation != null) {
                stmt.setString(idx++, generation.model());
                stmt.setString(idx++, generation.promptHash());
                stmt.setInt(idx++, generation.totalTokens());
                stmt.setLong(idx++, generation.latencyMillis());
                stmt.setBoolean(idx++, generation.cached());
            } else {
                stmt.setNull(idx++, Types.VARCHAR);
                stmt.setNull(idx++, Types.VARCHAR);
                stmt.setNull(idx++, Types.INTEGER);
                stmt.setNull(idx++, Types.BIGINT);
                stmt.setNull(idx++, Types.BOOLEAN);
            }
            stmt.setString(idx++, suggestion.author());
            setInstant(stmt, idx++, suggestion.createdAt());
            setInstant(stmt, idx, suggestion.expiresAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public Optional<Suggestion> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_suggestion"))) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find suggestion: " + id, e);
            throw new PersistenceException("Failed to find suggestion", e);
        }
    }

    @Override
    public List<Suggestion> find(SuggestionStatus status, String author, int limit, int offset) {
        String statusWire = status == null ? null : status.wire();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_suggestions"))) {
            stmt.setString(1, statusWire);
            stmt.setString(2, statusWire);
            stmt.setString(3, author);
            stmt.setString(4, author);
            stmt.setInt(5, limit);
            stmt.setInt(6, offset);
            return readAll(stmt);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to list suggestions", e);
            throw new PersistenceException("Failed to list suggestions", e);
        }
    }

    @Override
    public List<Suggestion> findOverdue(Instant now, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_overdue"))) {
            setInstant(stmt, 1, now);
            stmt.setInt(2, limit);
            return readAll(stmt);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find overdue suggestions", e);
            throw new PersistenceException("Failed to find overdue suggestions", e);
        }
    }

    @Override
    public boolean approve(Suggestion approved, ActiveRule promoted, RuleVersion version, AuditEntry audit) {
        try {
            return inTransaction(conn -> {
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(sql("approve_suggestion"))) {
                    stmt.setString(1, approved.reviewer());
                    stmt.setString(2, approved.reviewNotes());
                    stmt.setString(3, approved.expectedImpact());
                    setInstant(stmt, 4, approved.reviewedAt());
                    stmt.setString(5, approved.id());
                    updated = stmt.executeUpdate();
                }
                if (updated == 0) {
                    return false;
                }
                insertActiveRule(conn, promoted, approved.id());
                insertVersion(conn, version);
                JdbcAuditLog.insert(conn, audit);
                return true;
            });
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to approve suggestion: " + approved.id(), e);
            throw new PersistenceException("Failed to approve suggestion", e);
        }
    }

    @Override
    public boolean reject(Suggestion rejected, AuditEntry audit) {
        try {
            return inTransaction(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql("reject_suggestion"))) {
                    stmt.setString(1, rejected.reviewer());
                    stmt.setString(2, rejected.reviewNotes());
                    setInstant(stmt, 3, rejected.reviewedAt());
                    stmt.setString(4, rejected.id());
                    if (stmt.executeUpdate() == 0) {
                        return false;
                    }
                }
                JdbcAuditLog.insert(conn, audit);
                return true;
            });
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to reject suggestion: " + rejected.id(), e);
            throw new PersistenceException("Failed to reject suggestion", e);
        }
    }

    @Override
    public boolean expire(Suggestion expired, AuditEntry audit) {
        try {
            return inTransaction(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(sql("expire_suggestion"))) {
                    setInstant(stmt, 1, expired.reviewedAt());
                    stmt.setString(2, expired.id());
                    if (stmt.executeUpdate() == 0) {
                        return false;
                    }
                }
                JdbcAuditLog.insert(conn, audit);
                return true;
            });
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to expire suggestion: " + expired.id(), e);
            throw new PersistenceException("Failed to expire suggestion", e);
        }
    }

    /**
     * Runs the work in one transaction. It commits when the work returns true and rolls back
     * when it returns false or throws.
     */
    private boolean inTransaction(TransactionWork work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!work.run(conn)) {
                    conn.rollback();
                    return false;
                }
                conn.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @FunctionalInterface
    private interface TransactionWork {
        boolean run(Connection conn) throws SQLException;
    }

    private static void insertActiveRule(Connection conn, ActiveRule rule, String suggestionId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql("insert_active_rule"))) {
            int idx = 1;
            stmt.setString(idx++, rule.id());
            stmt.setString(idx++, rule.name());
            stmt.setString(idx++, toJson(rule.rule()));
            stmt.setInt(idx++, rule.version());
            stmt.setString(idx++, rule.author());
            stmt.setString(idx++, rule.approvedBy());
            stmt.setString(idx++, suggestionId);
            setInstant(stmt, idx++, rule.activatedAt());
            stmt.setBoolean(idx, rule.enabled());
            stmt.executeUpdate();
        }
    }

    private static void insertVersion(Connection conn, RuleVersion version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql("insert_rule_version"))) {
            int idx = 1;
            stmt.setString(idx++, version.id());
            stmt.setString(idx++, version.ruleId());
            stmt.setInt(idx++, version.version());
            stmt.setString(idx++, version.changeType().name().toLowerCase());
            stmt.setString(idx++, toJson(version.rule()));
            stmt.setString(idx++, version.fingerprint());
            stmt.setString(idx++, version.author());
            stmt.setString(idx++, version.approvedBy());
            stmt.setString(idx++, version.approvalNotes());
            stmt.setString(idx++, version.expectedImpact());
            stmt.setString(idx++, version.suggestionId());
            stmt.setString(idx++, toJson(version.impact()));
            stmt.setString(idx++, toJson(version.overlaps()));
            setInstant(stmt, idx, version.createdAt());
            stmt.executeUpdate();
        }
    }

    private static List<Suggestion> readAll(PreparedStatement stmt) throws SQLException {
        List<Suggestion> suggestions = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                suggestions.add(mapResultSet(rs));
            }
        }
        return suggestions;
    }

    private static Suggestion mapResultSet(ResultSet rs) throws SQLException {
        String model = rs.getString("llm_model");
        GenerationMetadata generation = model == null ? null : new GenerationMetadata(
                model,
                rs.getString("llm_prompt_sha256"),
                Boolean.TRUE.equals(getBooleanOrNull(rs, "llm_cached")),
                rs.getLong("llm_latency_ms"),
                valueOrZero(getIntegerOrNull(rs, "llm_tokens_used")));

        return new Suggestion(
                rs.getString("id"),
                SuggestionStatus.fromWire(rs.getString("status")),
                rs.getString("instruction"),
                fromJson(rs.getString("rule_json"), Rule.class),
                fromJson(rs.getString("validation_json"), ValidationResult.class),
                fromJson(rs.getString("violations_json"), VIOLATIONS),
                fromJson(rs.getString("impact_json"), ImpactReport.class),
                rs.getString("impact_error"),
                fromJson(rs.getString("overlaps_json"), OVERLAPS),
                generation,
                rs.getString("created_by"),
                rs.getString("reviewed_by"),
                rs.getString("review_notes"),
                rs.getString("expected_impact"),
                rs.getBoolean("impact_acknowledged"),
                getInstant(rs, "created_at"),
                getInstant(rs, "reviewed_at"),
                getInstant(rs, "expires_at"));
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
