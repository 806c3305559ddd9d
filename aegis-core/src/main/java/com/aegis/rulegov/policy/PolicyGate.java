/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.policy;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.ConditionValue;
import com.aegis.rulegov.api.model.PolicyConfig;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.TransactionRecord;
import com.aegis.rulegov.api.model.Violation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans instructions and rules for policy problems.
 *
 * <p>Instructions are checked for sensitive language (protected attributes, geography,
 * personal identifiers) before any generation happens. Rules are checked for disallowed
 * fields (error), PII fields (warning) and overly broad negations (warning). Stateless; all
 * configuration comes from {@link PolicyConfig}.
 */
public class PolicyGate {

    public static final String REDACTED = "[REDACTED]";

    private static final String LANGUAGE_SUGGESTION =
            "Describe the behaviour to detect with transaction features such as amount, device, "
                    + "timing or account age instead of protected, geographic or personal attributes.";
    private static final String DISALLOWED_SUGGESTION =
            "Remove this condition; rules must not target protected or geographic attributes.";
    private static final String PII_SUGGESTION =
            "Prefer behavioural features over identifiers; rules on individual customers need extra review.";
    private static final String NEGATION_SUGGESTION =
            "Add positive conditions that describe the risky behaviour instead of excluding a single value.";

    private final PolicyConfig policy;
    private final List<Pattern> sensitivePatterns;

    public PolicyGate(PolicyConfig policy) {
        this.policy = policy;
        this.sensitivePatterns = policy.sensitivePatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    /**
     * Runs both scans. Either argument may be null to skip that scan.
     */
    public List<Violation> gate(String instruction, Rule rule) {
        List<Violation> violations = new ArrayList<>();
        if (instruction != null) {
            violations.addAll(gateInstruction(instruction));
        }
        if (rule != null) {
            violations.addAll(gateRule(rule));
        }
        return violations;
    }

    public List<Violation> gateInstruction(String instruction) {
        List<Violation> violations = new ArrayList<>();
        for (Pattern pattern : sensitivePatterns) {
            Matcher matcher = pattern.matcher(instruction);
            if (matcher.find()) {
                violations.add(Violation.error(Violation.Type.SENSITIVE_LANGUAGE, null,
                        "Instruction contains sensitive term \"" + matcher.group() + "\"",
                        LANGUAGE_SUGGESTION));
            }
        }
        return violations;
    }

    public List<Violation> gateRule(Rule rule) {
        List<Violation> violations = new ArrayList<>();
        for (Condition.Leaf leaf : rule.leaves()) {
            String field = leaf.field();
            if (field == null) {
                continue;
            }
            if (policy.disallowedFields().contains(field)) {
                violations.add(Violation.error(Violation.Type.DISALLOWED_FIELD, field,
                        "Field \"" + field + "\" is not allowed in fraud rules", DISALLOWED_SUGGESTION));
            } else if (policy.piiFields().contains(field)) {
                violations.add(Violation.warning(Violation.Type.PII_FIELD, field,
                        "Field \"" + field + "\" contains personally identifiable information",
                        PII_SUGGESTION));
            }
        }
        if (isBroadNegation(rule)) {
            Condition.Leaf only = (Condition.Leaf) rule.conditions().get(0);
            violations.add(Violation.warning(Violation.Type.BROAD_NEGATION, only.field(),
                    "Rule matches everything except a single value of \"" + only.field()
                            + "\" and is likely too broad", NEGATION_SUGGESTION));
        }
        return violations;
    }

    /**
     * A rule whose whole condition list is one {@code !=}, or one {@code not_in} with a single
     * value, matches nearly the entire population.
     */
    private static boolean isBroadNegation(Rule rule) {
        if (rule.conditions() == null || rule.conditions().size() != 1
                || !(rule.conditions().get(0) instanceof Condition.Leaf leaf)) {
            return false;
        }
        if ("!=".equals(leaf.op())) {
            return true;
        }
        return "not_in".equals(leaf.op())
                && leaf.value() instanceof ConditionValue.ListOf list
                && list.items().size() == 1;
    }

    public static boolean hasBlocking(List<Violation> violations) {
        return violations.stream().anyMatch(Violation::isBlocking);
    }

    /**
     * Counts by severity and by type, for logs and audit payloads.
     */
    public static Map<String, Object> summarize(List<Violation> violations) {
        Map<Violation.Type, Integer> byType = new EnumMap<>(Violation.Type.class);
        int errors = 0;
        for (Violation violation : violations) {
            byType.merge(violation.type(), 1, Integer::sum);
            if (violation.isBlocking()) {
                errors++;
            }
        }
        Map<String, Integer> types = new LinkedHashMap<>();
        byType.forEach((type, count) -> types.put(type.wire(), count));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", violations.size());
        summary.put("errors", errors);
        summary.put("warnings", violations.size() - errors);
        summary.put("by_type", types);
        return summary;
    }

    /**
     * Returns a copy of the record with every PII feature replaced by {@value #REDACTED}.
     */
    public TransactionRecord stripPII(TransactionRecord record) {
        boolean hasPii = record.features().keySet().stream().anyMatch(policy.piiFields()::contains);
        if (!hasPii) {
            return record;
        }
        Map<String, Object> features = new HashMap<>(record.features());
        for (String field : policy.piiFields()) {
            if (features.containsKey(field)) {
                features.put(field, REDACTED);
            }
        }
        return new TransactionRecord(record.id(), record.timestamp(), record.decision(), features);
    }
}
