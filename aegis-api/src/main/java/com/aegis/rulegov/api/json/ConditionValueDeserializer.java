/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.json;

import com.aegis.rulegov.api.model.ConditionValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON literal into the matching {@link ConditionValue} variant without conversion.
 */
public class ConditionValueDeserializer extends StdDeserializer<ConditionValue> {

    public ConditionValueDeserializer() {
        super(ConditionValue.class);
    }

    @Override
    public ConditionValue deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return fromNode(node, parser);
    }

    @Override
    public ConditionValue getNullValue(DeserializationContext ctxt) {
        return ConditionValue.NULL;
    }

    static ConditionValue fromNode(JsonNode node, JsonParser parser) throws JsonMappingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ConditionValue.NULL;
        }
        if (node.isNumber()) {
            return new ConditionValue.Num(node.decimalValue());
        }
        if (node.isTextual()) {
            return new ConditionValue.Text(node.textValue());
        }
        if (node.isBoolean()) {
            return new ConditionValue.Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<ConditionValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromNode(item, parser));
            }
            return new ConditionValue.ListOf(items);
        }
        throw JsonMappingException.from(parser, "Unsupported condition value: " + node.getNodeType());
    }
}
