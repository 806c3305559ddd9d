/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.validation;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.ValidationError;
import com.aegis.rulegov.api.model.ValidationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks the shape of a rule: required members, naming, lengths, decision and condition count.
 *
 * <p>Does not look at the catalog. Reports every problem it finds, each with its path.
 */
public class RuleStructureValidator {

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9-]+$");
    static final int NAME_MIN = 3;
    static final int NAME_MAX = 100;
    static final int DESCRIPTION_MIN = 10;
    static final int DESCRIPTION_MAX = 500;

    private static final String DECISIONS = Arrays.stream(Decision.values())
            .map(Decision::wire)
            .collect(Collectors.joining(", "));

    private final int maxConditions;

    public RuleStructureValidator(int maxConditions) {
        this.maxConditions = maxConditions;
    }

    public ValidationResult validate(Rule rule) {
        List<ValidationError> errors = new ArrayList<>();
        if (rule == null) {
            errors.add(ValidationError.at("", "Rule is required"));
            return ValidationResult.of(errors, List.of());
        }

        validateName(rule.name(), errors);
        validateDescription(rule.description(), errors);
        validateDecision(rule.decision(), errors);
        validateConditions(rule.conditions(), errors);

        return ValidationResult.of(errors, List.of());
    }

    private void validateName(String name, List<ValidationError> errors) {
        if (name == null || name.isBlank()) {
            errors.add(ValidationError.at("ruleset_name", "Rule name is required"));
            return;
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            errors.add(ValidationError.at("ruleset_name",
                    "Rule name must be kebab-case (lowercase letters, digits and hyphens), got \"" + name + "\""));
        }
        if (name.length() < NAME_MIN || name.length() > NAME_MAX) {
            errors.add(ValidationError.at("ruleset_name",
                    "Rule name must be between " + NAME_MIN + " and " + NAME_MAX + " characters"));
        }
    }

    private void validateDescription(String description, List<ValidationError> errors) {
        if (description == null || description.isBlank()) {
            errors.add(ValidationError.at("description", "Description is required"));
            return;
        }
        int length = description.trim().length();
        if (length < DESCRIPTION_MIN || length > DESCRIPTION_MAX) {
            errors.add(ValidationError.at("description",
                    "Description must be between " + DESCRIPTION_MIN + " and " + DESCRIPTION_MAX
                            + " characters, got " + length));
        }
    }

    private void validateDecision(String decision, List<ValidationError> errors) {
        if (decision == null || decision.isBlank()) {
            errors.add(ValidationError.at("decision", "Decision is required"));
        } else if (Decision.fromWire(decision).isEmpty()) {
            errors.add(ValidationError.at("decision",
                    "Invalid decision \"" + decision + "\". Must be one of: " + DECISIONS));
        }
    }

    private void validateConditions(List<Condition> conditions, List<ValidationError> errors) {
        if (conditions == null || conditions.isEmpty()) {
            errors.add(ValidationError.at("conditions", "At least one condition is required"));
            return;
        }
        if (conditions.size() > maxConditions) {
            errors.add(ValidationError.at("conditions",
                    "Too many conditions: " + conditions.size() + " (max " + maxConditions + ")"));
            return;
        }
        for (int i = 0; i < conditions.size(); i++) {
            validateCondition(conditions.get(i), "conditions[" + i + "]", errors);
        }
    }

    private void validateCondition(Condition condition, String path, List<ValidationError> errors) {
        if (condition instanceof Condition.Leaf leaf) {
            if (leaf.field() == null || leaf.field().isBlank()) {
                errors.add(ValidationError.at(path + ".field", "Field is required"));
            }
            if (leaf.op() == null || leaf.op().isBlank()) {
                errors.add(ValidationError.at(path + ".op", "Operator is required"));
            }
            if (leaf.value() == null) {
                errors.add(ValidationError.at(path + ".value", "Value is required"));
            }
        } else if (condition instanceof Condition.All all) {
            validateGroup(all.conditions(), path + ".all", errors);
        } else if (condition instanceof Condition.Any any) {
            validateGroup(any.conditions(), path + ".any", errors);
        } else {
            errors.add(ValidationError.at(path, "Condition is required"));
        }
    }

    private void validateGroup(List<Condition> children, String path, List<ValidationError> errors) {
        if (children.isEmpty()) {
            errors.add(ValidationError.at(path, "Condition group must contain at least one condition"));
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            validateCondition(children.get(i), path + "[" + i + "]", errors);
        }
    }
}
