/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import com.aegis.rulegov.api.exceptions.PersistenceException;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the governance and projection tables on startup when they are missing.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

    private static final List<String> SCHEMA = SqlLoader.loadSchema("sql/schema.sql");

    @Inject
    DataSource dataSource;

    void onStart(@Observes @Priority(1) StartupEvent event) {
        logger.info("Initializing rule governance database schema...");
        createSchemaIfNotExists();
        logger.info("Rule governance schema initialized successfully");
    }

    public void createSchemaIfNotExists() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SCHEMA) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to initialize database schema", e);
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }
}
