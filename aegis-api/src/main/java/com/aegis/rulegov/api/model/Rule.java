/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A proposed or active fraud rule.
 *
 * <p>Top-level conditions are combined with AND. Decision and category are carried as their
 * wire strings until validation has run; use {@link #resolvedDecision()} afterwards.
 */
public record Rule(
        @JsonProperty("ruleset_name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("decision") String decision,
        @JsonProperty("category") String category,
        @JsonProperty("conditions") List<Condition> conditions
) {
    public Rule {
        // null list and null elements are kept for the structure validator to report
        if (conditions != null) {
            conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
        }
    }

    @JsonIgnore
    public Optional<Decision> resolvedDecision() {
        return Decision.fromWire(decision);
    }

    /**
     * Total leaf comparisons across the whole condition tree.
     */
    @JsonIgnore
    public int leafCount() {
        return conditions == null ? 0 : Condition.countLeaves(conditions);
    }

    /**
     * All leaves in depth-first order.
     */
    @JsonIgnore
    public List<Condition.Leaf> leaves() {
        List<Condition.Leaf> leaves = new ArrayList<>();
        if (conditions != null) {
            conditions.forEach(c -> collectLeaves(c, leaves));
        }
        return leaves;
    }

    private static void collectLeaves(Condition condition, List<Condition.Leaf> sink) {
        if (condition instanceof Condition.Leaf leaf) {
            sink.add(leaf);
        } else if (condition instanceof Condition.All all) {
            all.conditions().forEach(c -> collectLeaves(c, sink));
        } else if (condition instanceof Condition.Any any) {
            any.conditions().forEach(c -> collectLeaves(c, sink));
        }
    }

    public static Rule of(String name, String description, Decision decision, RuleCategory category,
                          Condition... conditions) {
        return new Rule(name, description, decision.wire(),
                category == null ? null : category.wire(), List.of(conditions));
    }
}
