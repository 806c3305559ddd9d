/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads SQL from classpath resources so statements live in .sql files rather than Java strings.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Load all named queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/queries.sql")
     * @return map of query names to SQL strings, without the trailing semicolon
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String currentName = null;
        StringBuilder current = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(NAME_MARKER)) {
                put(queries, currentName, current);
                currentName = line.substring(NAME_MARKER.length()).trim();
                current = new StringBuilder();
            } else if (line.startsWith("--") || line.isEmpty()) {
                continue;
            } else if (currentName != null) {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(line);
            }
        }
        put(queries, currentName, current);

        logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);
        return queries;
    }

    /**
     * Load a schema file as individual DDL statements.
     *
     * @param resourcePath path to SQL file (e.g., "sql/schema.sql")
     */
    public static List<String> loadSchema(String resourcePath) {
        StringBuilder schema = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                schema.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : schema.toString().split(";")) {
            if (!statement.isBlank()) {
                statements.add(statement.trim());
            }
        }
        logger.info("Loaded " + statements.size() + " schema statements from " + resourcePath);
        return statements;
    }

    private static void put(Map<String, String> queries, String name, StringBuilder sql) {
        if (name == null || sql.length() == 0) {
            return;
        }
        String statement = sql.toString().trim();
        if (statement.endsWith(";")) {
            statement = statement.substring(0, statement.length() - 1).trim();
        }
        queries.put(name, statement);
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("SQL resource not found: " + resourcePath);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            return reader.lines().toList();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read SQL from " + resourcePath, e);
            throw new UncheckedIOException("Failed to read SQL from " + resourcePath, e);
        }
    }
}
