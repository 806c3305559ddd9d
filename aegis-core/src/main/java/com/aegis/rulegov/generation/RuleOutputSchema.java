/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.generation;

import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.FeatureDescriptor;
import com.aegis.rulegov.api.model.Operator;
import com.aegis.rulegov.catalog.FeatureCatalog;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Expresses the feature catalog as a constrained output schema for the generator.
 *
 * <p>The generator is forced to call {@value #FUNCTION_NAME} with arguments matching
 * {@link #parameters()}; field names and operators are enumerated from the catalog so the
 * model cannot invent them. The output is still validated afterwards.
 */
public class RuleOutputSchema {

    public static final String FUNCTION_NAME = "create_fraud_rule";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final FeatureCatalog catalog;

    public RuleOutputSchema(FeatureCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Function definition in the chat-completions "tools" format.
     */
    public ObjectNode toolDefinition() {
        ObjectNode function = NODES.objectNode();
        function.put("name", FUNCTION_NAME);
        function.put("description", "Create a structured fraud detection rule from the analyst's instruction");
        function.set("parameters", parameters());

        ObjectNode tool = NODES.objectNode();
        tool.put("type", "function");
        tool.set("function", function);
        return tool;
    }

    public ObjectNode parameters() {
        ObjectNode properties = NODES.objectNode();
        properties.set("ruleset_name", NODES.objectNode()
                .put("type", "string")
                .put("pattern", "^[a-z0-9-]+$")
                .put("minLength", 3)
                .put("maxLength", 100)
                .put("description", "kebab-case rule name"));
        properties.set("description", NODES.objectNode()
                .put("type", "string")
                .put("minLength", 10)
                .put("maxLength", 500));
        properties.set("decision", enumOf(Decision.ALLOW.wire(), Decision.REVIEW.wire(), Decision.BLOCK.wire()));
        properties.set("category", enumOf(catalog.policy().categories().toArray(String[]::new)));
        properties.set("conditions", NODES.objectNode()
                .put("type", "array")
                .put("minItems", 1)
                .put("maxItems", catalog.policy().maxConditions())
                .set("items", conditionSchema()));

        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        schema.set("properties", properties);
        schema.set("required", array("ruleset_name", "description", "decision", "category", "conditions"));
        schema.put("additionalProperties", false);
        return schema;
    }

    private ObjectNode conditionSchema() {
        Set<String> operators = new LinkedHashSet<>();
        for (FeatureDescriptor feature : catalog.features()) {
            catalog.operatorsFor(feature.type()).stream().map(Operator::symbol).forEach(operators::add);
        }

        ObjectNode properties = NODES.objectNode();
        properties.set("field", enumOf(catalog.fieldNames().toArray(String[]::new)));
        properties.set("op", enumOf(operators.toArray(String[]::new)));
        properties.set("value", NODES.objectNode()
                .put("description", "number, string, boolean, or an array for in/not_in"));

        ObjectNode condition = NODES.objectNode();
        condition.put("type", "object");
        condition.set("properties", properties);
        condition.set("required", array("field", "op", "value"));
        return condition;
    }

    /**
     * System prompt describing the available features, their types and constraints, and the
     * fields that must never be used.
     */
    public String systemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You convert a fraud analyst's instruction into one fraud detection rule.\n")
                .append("Use only the fields below, with operators legal for their type.\n\n")
                .append("Fields:\n");
        for (FeatureDescriptor feature : catalog.features()) {
            if (feature.pii()) {
                continue;
            }
            prompt.append("- ").append(feature.name()).append(" (").append(feature.type()).append(')');
            if (feature.hasRange()) {
                prompt.append(" range ").append(plain(feature.min())).append("..").append(plain(feature.max()));
            }
            if (!feature.values().isEmpty()) {
                prompt.append(" one of ").append(String.join("/", feature.values()));
            }
            if (feature.description() != null) {
                prompt.append(": ").append(feature.description());
            }
            prompt.append('\n');
        }
        prompt.append("\nNever use: ").append(String.join(", ", catalog.policy().disallowedFields()))
                .append(".\nAt most ").append(catalog.policy().maxConditions())
                .append(" conditions. Conditions are combined with AND.\n")
                .append("Prefer review over block unless the instruction clearly asks to block.\n");
        return prompt.toString();
    }

    private static String plain(Double value) {
        return value == null ? "?" : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static ObjectNode enumOf(String... values) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "string");
        node.set("enum", array(values));
        return node;
    }

    private static ArrayNode array(String... values) {
        ArrayNode array = NODES.arrayNode();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
