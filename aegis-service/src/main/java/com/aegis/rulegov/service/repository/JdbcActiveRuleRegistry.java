/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.ActiveRuleRegistry;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.OverlapEntry;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.RuleVersion;
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
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.aegis.rulegov.service.repository.JdbcSupport.fromJson;
import static com.aegis.rulegov.service.repository.JdbcSupport.getInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.sql;

/**
 * Read side of the live rule set. Rules are written only by approval, inside
 * {@link JdbcSuggestionRepository#approve}.
 */
@ApplicationScoped
public class JdbcActiveRuleRegistry implements ActiveRuleRegistry {

    private static final Logger logger = Logger.getLogger(JdbcActiveRuleRegistry.class.getName());

    private static final TypeReference<List<OverlapEntry>> OVERLAPS = new TypeReference<>() {
    };

    @Inject
    DataSource dataSource;

    @Override
    public List<ActiveRule> findEnabled() {
        List<ActiveRule> rules = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_enabled_rules"));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rules.add(mapRule(rs));
            }
            return rules;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to load active rules", e);
            throw new PersistenceException("Failed to load active rules", e);
        }
    }

    @Override
    public Optional<ActiveRule> findById(String ruleId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_active_rule"))) {
            stmt.setString(1, ruleId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRule(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find active rule: " + ruleId, e);
            throw new PersistenceException("Failed to find active rule", e);
        }
    }

    @Override
    public List<RuleVersion> findVersions(String ruleId) {
        List<RuleVersion> versions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("select_rule_versions"))) {
            stmt.setString(1, ruleId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    versions.add(mapVersion(rs));
                }
            }
            return versions;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to load versions of rule: " + ruleId, e);
            throw new PersistenceException("Failed to load rule versions", e);
        }
    }

    private static ActiveRule mapRule(ResultSet rs) throws SQLException {
        return new ActiveRule(
                rs.getString("id"),
                fromJson(rs.getString("rule_json"), Rule.class),
                rs.getInt("version"),
                rs.getString("created_by"),
                rs.getString("approved_by"),
                getInstant(rs, "activated_at"),
                rs.getBoolean("enabled"));
    }

    private static RuleVersion mapVersion(ResultSet rs) throws SQLException {
        return new RuleVersion(
                rs.getString("id"),
                rs.getString("rule_id"),
                rs.getInt("version"),
                RuleVersion.ChangeType.valueOf(rs.getString("change_type").toUpperCase()),
                fromJson(rs.getString("rule_json"), Rule.class),
                rs.getString("rule_fingerprint"),
                rs.getString("created_by"),
                rs.getString("approved_by"),
                rs.getString("approval_notes"),
                rs.getString("expected_impact"),
                rs.getString("suggestion_id"),
                fromJson(rs.getString("impact_json"), ImpactReport.class),
                fromJson(rs.getString("overlaps_json"), OVERLAPS),
                getInstant(rs, "created_at"));
    }
}
