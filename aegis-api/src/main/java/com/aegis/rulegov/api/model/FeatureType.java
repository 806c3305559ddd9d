/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic type of a catalog feature.
 */
public enum FeatureType {
    NUMBER("number"),
    INTEGER("integer"),
    STRING("string"),
    ENUM("enum"),
    BOOLEAN("boolean");

    private final String wire;

    FeatureType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }

    @JsonCreator
    public static FeatureType fromWire(String value) {
        for (FeatureType type : values()) {
            if (type.wire.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown feature type: " + value);
    }

    @Override
    public String toString() {
        return wire;
    }
}
