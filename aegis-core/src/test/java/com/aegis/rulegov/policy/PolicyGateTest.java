package com.aegis.rulegov.policy;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.TransactionRecord;
import com.aegis.rulegov.api.model.Violation;
import com.aegis.rulegov.catalog.FeatureCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyGateTest {

    private PolicyGate gate;

    @BeforeEach
    void setUp() {
        gate = new PolicyGate(FeatureCatalog.loadDefault().policy());
    }

    private static Rule ruleWith(Condition... conditions) {
        return new Rule("policy-rule", "Rule used by policy tests", "review", null, List.of(conditions));
    }

    @Test
    @DisplayName("Should block instructions that target a region")
    void shouldFlagSensitiveInstruction() {
        List<Violation> violations = gate.gateInstruction("Block transactions from users in region X");

        assertThat(violations).isNotEmpty();
        assertThat(violations).allMatch(v -> v.type() == Violation.Type.SENSITIVE_LANGUAGE);
        assertThat(PolicyGate.hasBlocking(violations)).isTrue();
    }

    @Test
    @DisplayName("Should pass behavioural instructions")
    void shouldPassBehaviouralInstruction() {
        assertThat(gate.gateInstruction("Review mobile purchases above 5000 made between midnight and 5am"))
                .isEmpty();
    }

    @Test
    @DisplayName("Should warn once on a lone inequality")
    void shouldWarnOnBroadNegation() {
        List<Violation> violations = gate.gateRule(ruleWith(Condition.leaf("agent_id", "!=", "openai")));

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.type()).isEqualTo(Violation.Type.BROAD_NEGATION);
            assertThat(v.severity()).isEqualTo(Violation.Severity.WARNING);
        });
        assertThat(PolicyGate.hasBlocking(violations)).isFalse();
    }

    @Test
    @DisplayName("Should treat not_in with one value as a broad negation but not with several")
    void shouldCheckSingleValueNotIn() {
        assertThat(gate.gateRule(ruleWith(Condition.leaf("device", "not_in", List.of("web")))))
                .extracting(Violation::type).containsExactly(Violation.Type.BROAD_NEGATION);
        assertThat(gate.gateRule(ruleWith(Condition.leaf("device", "not_in", List.of("web", "tablet")))))
                .isEmpty();
        assertThat(gate.gateRule(ruleWith(Condition.leaf("agent_id", "!=", "x"), Condition.leaf("amount", ">", 1))))
                .isEmpty();
    }

    @Test
    @DisplayName("Should error on disallowed fields and warn on PII, including nested conditions")
    void shouldScanFields() {
        Rule rule = ruleWith(
                Condition.leaf("amount", ">", 100),
                Condition.any(Condition.leaf("country", "==", "XX"), Condition.leaf("user_id", "==", "u-1")));

        List<Violation> violations = gate.gateRule(rule);

        assertThat(violations).extracting(Violation::type, Violation::severity, Violation::field).containsExactly(
                org.assertj.core.groups.Tuple.tuple(Violation.Type.DISALLOWED_FIELD, Violation.Severity.ERROR, "country"),
                org.assertj.core.groups.Tuple.tuple(Violation.Type.PII_FIELD, Violation.Severity.WARNING, "user_id"));
    }

    @Test
    @DisplayName("Should summarize by severity and type")
    void shouldSummarize() {
        List<Violation> violations = gate.gate("users by email", ruleWith(Condition.leaf("agent_id", "!=", "x")));

        Map<String, Object> summary = PolicyGate.summarize(violations);

        assertThat(summary).containsEntry("errors", 1).containsEntry("warnings", 1).containsEntry("total", 2);
    }

    @Test
    @DisplayName("Should redact PII features")
    void shouldStripPii() {
        TransactionRecord record = new TransactionRecord("t1", Instant.now(), null,
                Map.of("user_id", "u-42", "amount", 10));

        TransactionRecord stripped = gate.stripPII(record);

        assertThat(stripped.feature("user_id")).isEqualTo(PolicyGate.REDACTED);
        assertThat(stripped.feature("amount")).isEqualTo(10);
        assertThat(record.feature("user_id")).isEqualTo("u-42");
    }
}
