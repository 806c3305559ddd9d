/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.evaluation;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.ConditionValue;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.Operator;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.TransactionRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Evaluates rule conditions against a single transaction record.
 *
 * <h2>Semantics</h2>
 * <ul>
 * <li>Top-level conditions and {@code all} groups are short-circuit AND, {@code any} groups
 * short-circuit OR.</li>
 * <li>No coercion: the text {@code "5000"} never equals the number {@code 5000}.</li>
 * <li>Ordering operators only hold for numeric record values.</li>
 * <li>{@code contains} and {@code not_contains} only hold for string record values.</li>
 * <li>A missing (or null) record value fails the leaf, whatever the operator.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe. Unknown operators evaluate to false; validation rejects them
 * before a rule gets here.
 */
public final class ConditionEvaluator {

    /**
     * Decision the rule alone produces for the record: its own decision when every condition
     * holds, otherwise allow.
     */
    public Decision decide(Rule rule, TransactionRecord record) {
        if (!matches(rule, record)) {
            return Decision.ALLOW;
        }
        return rule.resolvedDecision().orElse(Decision.ALLOW);
    }

    public boolean matches(Rule rule, TransactionRecord record) {
        List<Condition> conditions = rule.conditions();
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        return allHold(conditions, record);
    }

    public boolean matches(Condition condition, TransactionRecord record) {
        if (condition instanceof Condition.Leaf leaf) {
            return holds(leaf, record);
        }
        if (condition instanceof Condition.All all) {
            return allHold(all.conditions(), record);
        }
        if (condition instanceof Condition.Any any) {
            for (Condition child : any.conditions()) {
                if (matches(child, record)) {
                    return true;
                }
            }
            return false;
        }
        return false;
    }

    private boolean allHold(List<Condition> conditions, TransactionRecord record) {
        for (Condition child : conditions) {
            if (!matches(child, record)) {
                return false;
            }
        }
        return true;
    }

    private boolean holds(Condition.Leaf leaf, TransactionRecord record) {
        Object actual = leaf.field() == null ? null : record.feature(leaf.field());
        ConditionValue expected = leaf.value();
        Optional<Operator> operator = leaf.operator();
        if (actual == null || expected == null || operator.isEmpty()) {
            return false;
        }
        return switch (operator.get()) {
            case EQUAL_TO -> equalTo(actual, expected);
            case NOT_EQUAL_TO -> !(expected instanceof ConditionValue.Null) && !equalTo(actual, expected);
            case GREATER_THAN -> ordered(actual, expected, c -> c > 0);
            case LESS_THAN -> ordered(actual, expected, c -> c < 0);
            case GREATER_THAN_OR_EQUAL -> ordered(actual, expected, c -> c >= 0);
            case LESS_THAN_OR_EQUAL -> ordered(actual, expected, c -> c <= 0);
            case IS_ANY_OF -> isAnyOf(actual, expected);
            case IS_NONE_OF -> expected instanceof ConditionValue.ListOf && !isAnyOf(actual, expected);
            case CONTAINS -> actual instanceof String text && expected instanceof ConditionValue.Text sub
                    && text.contains(sub.value());
            case NOT_CONTAINS -> actual instanceof String text && expected instanceof ConditionValue.Text sub
                    && !text.contains(sub.value());
        };
    }

    private static boolean ordered(Object actual, ConditionValue expected, IntPredicate test) {
        if (!(actual instanceof Number number) || !(expected instanceof ConditionValue.Num num)) {
            return false;
        }
        return test.test(toDecimal(number).compareTo(num.value()));
    }

    private static boolean equalTo(Object actual, ConditionValue expected) {
        if (expected instanceof ConditionValue.Num num) {
            return actual instanceof Number number && toDecimal(number).compareTo(num.value()) == 0;
        }
        if (expected instanceof ConditionValue.Text text) {
            return actual instanceof String s && s.equals(text.value());
        }
        if (expected instanceof ConditionValue.Bool bool) {
            return actual instanceof Boolean b && b == bool.value();
        }
        return false;
    }

    private static boolean isAnyOf(Object actual, ConditionValue expected) {
        if (!(expected instanceof ConditionValue.ListOf list)) {
            return false;
        }
        for (ConditionValue item : list.items()) {
            if (equalTo(actual, item)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
