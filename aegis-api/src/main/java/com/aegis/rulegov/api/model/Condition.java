/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.aegis.rulegov.api.json.ConditionDeserializer;
import com.aegis.rulegov.api.json.ConditionSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a rule's condition tree.
 *
 * <p>Leaves compare one record field against a literal; {@link All} and {@link Any} combine
 * children with AND and OR. Field and operator are kept as given so that unknown names reach
 * the validators instead of failing at parse time.
 */
@JsonSerialize(using = ConditionSerializer.class)
@JsonDeserialize(using = ConditionDeserializer.class)
public sealed interface Condition {

    /** Number of leaf comparisons beneath this node, itself included. */
    int leafCount();

    /**
     * @param field field name, null when absent
     * @param op    operator symbol, null when absent
     * @param value literal, null when absent (a JSON null is {@link ConditionValue#NULL})
     */
    record Leaf(String field, String op, ConditionValue value) implements Condition {
        @Override
        public int leafCount() {
            return 1;
        }

        public Optional<Operator> operator() {
            return Operator.fromSymbol(op);
        }
    }

    /** Children may contain nulls until the rule has passed structure validation. */
    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
        }

        @Override
        public int leafCount() {
            return Condition.countLeaves(conditions);
        }
    }

    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
        }

        @Override
        public int leafCount() {
            return Condition.countLeaves(conditions);
        }
    }

    /** Sum of {@link #leafCount()} over the non-null conditions. */
    static int countLeaves(List<Condition> conditions) {
        return conditions.stream().filter(Objects::nonNull).mapToInt(Condition::leafCount).sum();
    }

    static Leaf leaf(String field, String op, Object value) {
        return new Leaf(field, op, ConditionValue.of(value));
    }

    static All all(Condition... conditions) {
        return new All(List.of(conditions));
    }

    static Any any(Condition... conditions) {
        return new Any(List.of(conditions));
    }
}
