/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.validation;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.ConditionValue;
import com.aegis.rulegov.api.model.FeatureDescriptor;
import com.aegis.rulegov.api.model.FeatureType;
import com.aegis.rulegov.api.model.Operator;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.ValidationError;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.catalog.FeatureCatalog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks every condition of a rule against the feature catalog.
 *
 * <p>Field existence, operator legality for the field's type, value kind, integer-ness,
 * numeric ranges, enum membership, string length and nullability. Values are never coerced:
 * {@code "5000"} for a numeric field is an error. Messages name the offending value and the
 * accepted alternatives so the author can fix the rule without reading the catalog.
 *
 * <p>When the rule exceeds the policy's condition limit a single error is reported and the
 * per-condition checks are skipped.
 */
public class CatalogValidator {

    private final FeatureCatalog catalog;

    public CatalogValidator(FeatureCatalog catalog) {
        this.catalog = catalog;
    }

    public ValidationResult validate(Rule rule) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();

        int max = catalog.policy().maxConditions();
        int leaves = rule.leafCount();
        if (leaves > max) {
            errors.add(ValidationError.at("conditions",
                    "Too many conditions: " + leaves + " (max " + max + ")"));
            return ValidationResult.of(errors, warnings);
        }

        if (rule.category() != null && !catalog.policy().categories().contains(rule.category())) {
            warnings.add(ValidationError.at("category", "Invalid category \"" + rule.category()
                    + "\". Valid categories: " + String.join(", ", catalog.policy().categories())));
        }

        if (rule.conditions() != null) {
            for (int i = 0; i < rule.conditions().size(); i++) {
                validateCondition(rule.conditions().get(i), "conditions[" + i + "]", errors);
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    private void validateCondition(Condition condition, String path, List<ValidationError> errors) {
        if (condition instanceof Condition.Leaf leaf) {
            validateLeaf(leaf, path, errors);
        } else if (condition instanceof Condition.All all) {
            for (int i = 0; i < all.conditions().size(); i++) {
                validateCondition(all.conditions().get(i), path + ".all[" + i + "]", errors);
            }
        } else if (condition instanceof Condition.Any any) {
            for (int i = 0; i < any.conditions().size(); i++) {
                validateCondition(any.conditions().get(i), path + ".any[" + i + "]", errors);
            }
        }
    }

    private void validateLeaf(Condition.Leaf leaf, String path, List<ValidationError> errors) {
        if (leaf.field() == null) {
            errors.add(ValidationError.at(path + ".field", "Field is required"));
            return;
        }
        Optional<FeatureDescriptor> found = catalog.feature(leaf.field());
        if (found.isEmpty()) {
            errors.add(ValidationError.at(path + ".field", "Unknown field \"" + leaf.field()
                    + "\". Must be one of: " + String.join(", ", catalog.fieldNames())));
            return;
        }
        FeatureDescriptor feature = found.get();

        Optional<Operator> resolved = leaf.operator();
        if (resolved.isEmpty()) {
            errors.add(ValidationError.at(path + ".op", "Unknown operator \"" + leaf.op() + "\""));
            return;
        }
        Operator op = resolved.get();
        if (!catalog.isLegal(feature.type(), op)) {
            errors.add(ValidationError.at(path + ".op", "Operator \"" + op + "\" not valid for field \""
                    + feature.name() + "\" (type: " + feature.type() + "). Valid operators: "
                    + catalog.operatorsFor(feature.type()).stream()
                    .map(Operator::symbol)
                    .collect(Collectors.joining(", "))));
            return;
        }

        ConditionValue value = leaf.value();
        String valuePath = path + ".value";
        if (value == null) {
            errors.add(ValidationError.at(valuePath, "Value is required"));
            return;
        }

        if (op.isMembership()) {
            if (!(value instanceof ConditionValue.ListOf list)) {
                errors.add(ValidationError.at(valuePath, "Operator \"" + op + "\" requires an array value"));
                return;
            }
            if (list.items().isEmpty()) {
                errors.add(ValidationError.at(valuePath, "Operator \"" + op + "\" requires a non-empty array"));
                return;
            }
            for (int j = 0; j < list.items().size(); j++) {
                validateScalar(feature, list.items().get(j), valuePath + "[" + j + "]", errors);
            }
            return;
        }

        if (value instanceof ConditionValue.ListOf) {
            errors.add(ValidationError.at(valuePath, "Operator \"" + op + "\" requires a single value, got array"));
            return;
        }
        if (value instanceof ConditionValue.Null && (op.isOrdering() || op.isContainment())) {
            errors.add(ValidationError.at(valuePath, "Operator \"" + op + "\" cannot compare against null"));
            return;
        }
        validateScalar(feature, value, valuePath, errors);
    }

    private void validateScalar(FeatureDescriptor feature, ConditionValue value, String path,
                                List<ValidationError> errors) {
        String name = feature.name();
        if (value instanceof ConditionValue.Null) {
            if (!feature.nullable()) {
                errors.add(ValidationError.at(path, name + " cannot be null (field is not_null)"));
            }
            return;
        }

        switch (feature.type()) {
            case NUMBER, INTEGER -> {
                if (!(value instanceof ConditionValue.Num num)) {
                    errors.add(typeMismatch(path, name, "number", value));
                    return;
                }
                if (feature.type() == FeatureType.INTEGER && !num.isIntegral()) {
                    errors.add(ValidationError.at(path, "Field \"" + name + "\" requires an integer, got "
                            + num.display()));
                    return;
                }
                checkRange(feature, num, path, errors);
            }
            case STRING -> {
                if (!(value instanceof ConditionValue.Text text)) {
                    errors.add(typeMismatch(path, name, "string", value));
                    return;
                }
                if (feature.maxLength() != null && text.value().length() > feature.maxLength()) {
                    errors.add(ValidationError.at(path, "Value for \"" + name + "\" exceeds max length of "
                            + feature.maxLength() + " characters"));
                }
            }
            case ENUM -> {
                if (!(value instanceof ConditionValue.Text text)) {
                    errors.add(typeMismatch(path, name, "string", value));
                    return;
                }
                if (!feature.values().contains(text.value())) {
                    errors.add(ValidationError.at(path, "\"" + text.value() + "\" is not a valid value for \""
                            + name + "\". Valid values: " + String.join(", ", feature.values())));
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof ConditionValue.Bool)) {
                    errors.add(typeMismatch(path, name, "boolean", value));
                }
            }
        }
    }

    private void checkRange(FeatureDescriptor feature, ConditionValue.Num num, String path,
                            List<ValidationError> errors) {
        if (!feature.hasRange()) {
            return;
        }
        BigDecimal v = num.value();
        boolean belowMin = feature.min() != null && v.compareTo(BigDecimal.valueOf(feature.min())) < 0;
        boolean aboveMax = feature.max() != null && v.compareTo(BigDecimal.valueOf(feature.max())) > 0;
        if (belowMin || aboveMax) {
            errors.add(ValidationError.at(path, "Value " + num.display() + " out of range for \""
                    + feature.name() + "\". Valid range: [" + bound(feature.min(), "-inf") + ", "
                    + bound(feature.max(), "inf") + "]"));
        }
    }

    private static String bound(Double bound, String open) {
        return bound == null ? open : BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
    }

    private static ValidationError typeMismatch(String path, String field, String expected, ConditionValue actual) {
        return ValidationError.at(path, "Field \"" + field + "\" requires " + expected + ", got "
                + actual.kind() + " " + quoted(actual));
    }

    private static String quoted(ConditionValue value) {
        return value instanceof ConditionValue.Text ? "\"" + value.display() + "\"" : value.display();
    }
}
