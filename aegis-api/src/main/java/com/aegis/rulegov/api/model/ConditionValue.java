/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.aegis.rulegov.api.json.ConditionValueDeserializer;
import com.aegis.rulegov.api.json.ConditionValueSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Literal a condition compares against.
 *
 * <p>A closed sum over the JSON value kinds. Values are never converted between variants:
 * the text {@code "5000"} is not the number {@code 5000}.
 */
@JsonSerialize(using = ConditionValueSerializer.class)
@JsonDeserialize(using = ConditionValueDeserializer.class)
public sealed interface ConditionValue {

    /** Kind name used in validation messages. */
    String kind();

    /** Raw rendering used in validation messages. */
    String display();

    record Num(BigDecimal value) implements ConditionValue {
        public Num {
            if (value == null) {
                throw new IllegalArgumentException("Numeric condition value cannot be null");
            }
        }

        public boolean isIntegral() {
            return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
        }

        public double asDouble() {
            return value.doubleValue();
        }

        @Override
        public String kind() {
            return "number";
        }

        @Override
        public String display() {
            return value.stripTrailingZeros().toPlainString();
        }
    }

    record Text(String value) implements ConditionValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("Text condition value cannot be null");
            }
        }

        @Override
        public String kind() {
            return "string";
        }

        @Override
        public String display() {
            return value;
        }
    }

    record Bool(boolean value) implements ConditionValue {
        @Override
        public String kind() {
            return "boolean";
        }

        @Override
        public String display() {
            return Boolean.toString(value);
        }
    }

    record ListOf(List<ConditionValue> items) implements ConditionValue {
        public ListOf {
            items = List.copyOf(items);
        }

        @Override
        public String kind() {
            return "array";
        }

        @Override
        public String display() {
            return items.stream().map(ConditionValue::display).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record Null() implements ConditionValue {
        @Override
        public String kind() {
            return "null";
        }

        @Override
        public String display() {
            return "null";
        }
    }

    Null NULL = new Null();

    /**
     * Wraps a plain Java value. Supports numbers, strings, booleans, collections and null.
     */
    static ConditionValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof ConditionValue value) {
            return value;
        }
        if (raw instanceof BigDecimal decimal) {
            return new Num(decimal);
        }
        if (raw instanceof Double || raw instanceof Float) {
            return new Num(BigDecimal.valueOf(((Number) raw).doubleValue()));
        }
        if (raw instanceof Number number) {
            return new Num(BigDecimal.valueOf(number.longValue()));
        }
        if (raw instanceof String text) {
            return new Text(text);
        }
        if (raw instanceof Boolean bool) {
            return new Bool(bool);
        }
        if (raw instanceof Collection<?> collection) {
            List<ConditionValue> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(of(item));
            }
            return new ListOf(items);
        }
        throw new IllegalArgumentException("Unsupported condition value type: " + raw.getClass().getName());
    }
}
