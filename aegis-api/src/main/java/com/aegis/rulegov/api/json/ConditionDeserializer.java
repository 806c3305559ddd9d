/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.json;

import com.aegis.rulegov.api.model.Condition;
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
 * Reads condition trees.
 *
 * <p>Accepted shapes:
 * <pre>
 * {"field": "amount", "op": "&gt;", "value": 5000}
 * {"all": [ ...conditions ]}
 * {"any": [ ...conditions ]}
 * </pre>
 * {@code operator} is accepted as an alias of {@code op}. Missing leaf members are kept as
 * null so the structure validator can report them with their path.
 */
public class ConditionDeserializer extends StdDeserializer<Condition> {

    public ConditionDeserializer() {
        super(Condition.class);
    }

    @Override
    public Condition deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return fromNode(node, parser);
    }

    private static Condition fromNode(JsonNode node, JsonParser parser) throws JsonMappingException {
        if (node == null || !node.isObject()) {
            throw JsonMappingException.from(parser, "Condition must be a JSON object");
        }
        if (node.has("all")) {
            return new Condition.All(children(node.get("all"), "all", parser));
        }
        if (node.has("any")) {
            return new Condition.Any(children(node.get("any"), "any", parser));
        }

        String field = text(node.get("field"));
        String op = text(node.has("op") ? node.get("op") : node.get("operator"));
        ConditionValue value = node.has("value")
                ? ConditionValueDeserializer.fromNode(node.get("value"), parser)
                : null;
        return new Condition.Leaf(field, op, value);
    }

    private static List<Condition> children(JsonNode array, String name, JsonParser parser)
            throws JsonMappingException {
        if (!array.isArray()) {
            throw JsonMappingException.from(parser, "\"" + name + "\" must be an array of conditions");
        }
        List<Condition> children = new ArrayList<>(array.size());
        for (JsonNode child : array) {
            // a null child is reported by the structure validator
            children.add(child.isNull() ? null : fromNode(child, parser));
        }
        return children;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
