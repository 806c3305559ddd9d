/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.StratumQuery;
import com.aegis.rulegov.api.TransactionRecordStore;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.SampleFilter;
import com.aegis.rulegov.api.model.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.aegis.rulegov.service.repository.JdbcSupport.getBooleanOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.getInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.getIntegerOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.setBooleanOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.setInstant;
import static com.aegis.rulegov.service.repository.JdbcSupport.setIntegerOrNull;
import static com.aegis.rulegov.service.repository.JdbcSupport.sql;

/**
 * Stratum queries over the {@code transactions_proj} projection.
 *
 * <p>The projection carries only the columns the simulator reads, plus a precomputed
 * {@code weekend} flag so the off-hours stratum needs no dialect-specific date functions.
 * Each query selects the same population as {@link StratumQuery#matches(TransactionRecord)}.
 */
@ApplicationScoped
public class JdbcTransactionRecordStore implements TransactionRecordStore {

    private static final Logger logger = Logger.getLogger(JdbcTransactionRecordStore.class.getName());

    @Inject
    DataSource dataSource;

    @Override
    public List<TransactionRecord> query(StratumQuery query) {
        String name = "sample_" + query.stratum().wire();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql(name))) {
            int idx = 1;
            setInstant(stmt, idx++, query.since());
            switch (query.stratum()) {
                case WEEKEND_OFF_HOURS -> {
                    stmt.setInt(idx++, query.businessHoursStart());
                    stmt.setInt(idx++, query.businessHoursEnd());
                }
                case HIGH_VALUE -> stmt.setDouble(idx++, query.highValueThreshold());
                default -> {
                }
            }
            idx = bindFilter(stmt, idx, query.filter());
            stmt.setInt(idx, query.limit());

            List<TransactionRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapResultSet(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Stratum query failed: " + name, e);
            throw new PersistenceException("Stratum query failed: " + query.stratum().wire(), e);
        }
    }

    /**
     * Adds a record to the projection. Used by loaders and tests; the simulator only reads.
     */
    public void insert(TransactionRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("insert_transaction"))) {
            ZonedDateTime at = record.timestamp().atZone(ZoneOffset.UTC);
            Object hour = record.feature("hour");
            int idx = 1;
            stmt.setString(idx++, record.id());
            setInstant(stmt, idx++, record.timestamp());
            stmt.setString(idx++, record.decision() == null ? null : record.decision().wire());
            stmt.setDouble(idx++, record.amount());
            stmt.setInt(idx++, hour instanceof Number n ? n.intValue() : at.getHour());
            stmt.setBoolean(idx++, at.getDayOfWeek() == DayOfWeek.SATURDAY || at.getDayOfWeek() == DayOfWeek.SUNDAY);
            stmt.setString(idx++, text(record, "device"));
            stmt.setString(idx++, text(record, "agent_id"));
            stmt.setString(idx++, text(record, "partner"));
            stmt.setString(idx++, text(record, "intent"));
            setIntegerOrNull(stmt, idx++, record.feature("account_age_days") instanceof Number n ? n.intValue() : null);
            setBooleanOrNull(stmt, idx++, record.feature("is_first_transaction") instanceof Boolean b ? b : null);
            stmt.setBoolean(idx++, record.flag("flagged"));
            stmt.setBoolean(idx++, record.flag("disputed"));
            stmt.setBoolean(idx++, record.flag("declined"));
            stmt.setString(idx++, text(record, "seller_name"));
            stmt.setString(idx, text(record, "user_id"));
            stmt.executeUpdate();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to insert transaction: " + record.id(), e);
            throw new PersistenceException("Failed to insert transaction", e);
        }
    }

    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("count_transactions"));
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count transactions", e);
        }
    }

    private static int bindFilter(PreparedStatement stmt, int idx, SampleFilter filter) throws SQLException {
        for (String value : new String[]{filter.device(), filter.agentId(), filter.partner()}) {
            stmt.setString(idx++, value);
            stmt.setString(idx++, value);
        }
        setInstant(stmt, idx++, filter.from());
        setInstant(stmt, idx++, filter.from());
        setInstant(stmt, idx++, filter.to());
        setInstant(stmt, idx++, filter.to());
        return idx;
    }

    private static String text(TransactionRecord record, String field) {
        Object value = record.feature(field);
        return value == null ? null : value.toString();
    }

    private static TransactionRecord mapResultSet(ResultSet rs) throws SQLException {
        Map<String, Object> features = new HashMap<>();
        features.put("amount", rs.getDouble("amount"));
        features.put("hour", rs.getInt("hour_of_day"));
        features.put("device", rs.getString("device"));
        features.put("agent_id", rs.getString("agent_id"));
        features.put("partner", rs.getString("partner"));
        features.put("intent", rs.getString("intent"));
        features.put("account_age_days", getIntegerOrNull(rs, "account_age_days"));
        features.put("is_first_transaction", getBooleanOrNull(rs, "is_first_transaction"));
        features.put("flagged", rs.getBoolean("flagged"));
        features.put("disputed", rs.getBoolean("disputed"));
        features.put("declined", rs.getBoolean("declined"));
        features.put("seller_name", rs.getString("seller_name"));
        features.put("user_id", rs.getString("user_id"));

        String decision = rs.getString("decision");
        return new TransactionRecord(
                rs.getString("txn_id"),
                getInstant(rs, "ts"),
                decision == null ? null : Decision.fromWire(decision).orElse(null),
                features);
    }
}
