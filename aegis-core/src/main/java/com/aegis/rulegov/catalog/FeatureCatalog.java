/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.catalog;

import com.aegis.rulegov.api.json.RuleJson;
import com.aegis.rulegov.api.model.FeatureDescriptor;
import com.aegis.rulegov.api.model.FeatureType;
import com.aegis.rulegov.api.model.Operator;
import com.aegis.rulegov.api.model.PolicyConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Authoritative list of fields a rule may reference, the operators legal for each semantic
 * type, and the governance policy.
 *
 * <p>Loaded once and immutable afterwards; safe to share between threads.
 */
public final class FeatureCatalog {

    private static final Logger logger = Logger.getLogger(FeatureCatalog.class.getName());

    public static final String DEFAULT_RESOURCE = "feature-catalog.json";

    private final String version;
    private final Map<String, FeatureDescriptor> features;
    private final Map<FeatureType, List<Operator>> operators;
    private final PolicyConfig policy;

    private FeatureCatalog(String version, Map<String, FeatureDescriptor> features,
                           Map<FeatureType, List<Operator>> operators, PolicyConfig policy) {
        this.version = version;
        this.features = Collections.unmodifiableMap(features);
        this.operators = Collections.unmodifiableMap(operators);
        this.policy = policy;
    }

    private static final class DefaultHolder {
        static final FeatureCatalog INSTANCE = loadResource(DEFAULT_RESOURCE);
    }

    /**
     * The catalog bundled with the application.
     */
    public static FeatureCatalog loadDefault() {
        return DefaultHolder.INSTANCE;
    }

    public static FeatureCatalog loadResource(String resourcePath) {
        try (InputStream is = FeatureCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Feature catalog resource not found: " + resourcePath);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read feature catalog: " + resourcePath, e);
        }
    }

    public static FeatureCatalog load(InputStream input) {
        CatalogDocument document;
        try {
            document = RuleJson.mapper().readValue(input, CatalogDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse feature catalog", e);
        }
        if (document.features() == null || document.features().isEmpty()) {
            throw new IllegalStateException("Feature catalog must define at least one feature");
        }
        if (document.policy() == null) {
            throw new IllegalStateException("Feature catalog must define a policy section");
        }

        Map<String, FeatureDescriptor> features = new LinkedHashMap<>();
        for (FeatureDescriptor feature : document.features()) {
            if (features.putIfAbsent(feature.name(), feature) != null) {
                throw new IllegalStateException("Duplicate feature in catalog: " + feature.name());
            }
        }

        Map<FeatureType, List<Operator>> operators = new EnumMap<>(FeatureType.class);
        for (FeatureType type : FeatureType.values()) {
            List<String> symbols = document.operators() == null ? null : document.operators().get(type.wire());
            if (symbols == null) {
                throw new IllegalStateException("Feature catalog defines no operators for type " + type);
            }
            List<Operator> legal = new ArrayList<>(symbols.size());
            for (String symbol : symbols) {
                legal.add(Operator.fromSymbol(symbol).orElseThrow(() ->
                        new IllegalStateException("Unknown operator in catalog: " + symbol)));
            }
            operators.put(type, List.copyOf(legal));
        }

        logger.info(String.format("Loaded feature catalog %s: %d features, %d disallowed fields",
                document.version(), features.size(), document.policy().disallowedFields().size()));
        return new FeatureCatalog(document.version(), features, operators, document.policy());
    }

    public String version() {
        return version;
    }

    public Optional<FeatureDescriptor> feature(String name) {
        return Optional.ofNullable(name == null ? null : features.get(name));
    }

    public Collection<FeatureDescriptor> features() {
        return features.values();
    }

    public List<String> fieldNames() {
        return List.copyOf(features.keySet());
    }

    public List<Operator> operatorsFor(FeatureType type) {
        return operators.get(type);
    }

    public boolean isLegal(FeatureType type, Operator operator) {
        return operators.get(type).contains(operator);
    }

    public PolicyConfig policy() {
        return policy;
    }

    record CatalogDocument(
            @JsonProperty("version") String version,
            @JsonProperty("features") List<FeatureDescriptor> features,
            @JsonProperty("operators") Map<String, List<String>> operators,
            @JsonProperty("policy") PolicyConfig policy
    ) {
    }
}
