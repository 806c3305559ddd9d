package com.aegis.rulegov.evaluation;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static TransactionRecord record(Map<String, Object> features) {
        return new TransactionRecord("txn-1", Instant.parse("2025-03-01T10:00:00Z"), Decision.ALLOW, features);
    }

    @Test
    @DisplayName("Should compare numbers regardless of their Java representation")
    void shouldCompareNumbers() {
        TransactionRecord record = record(Map.of("amount", 12000, "hour", 3L));

        assertThat(evaluator.matches(Condition.leaf("amount", ">", 10000), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("amount", ">=", 12000.0), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("amount", "<", 12000), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("amount", "==", 12000), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("hour", "<=", 3), record)).isTrue();
    }

    @Test
    @DisplayName("Should never coerce between strings and numbers")
    void shouldNotCoerce() {
        TransactionRecord record = record(Map.of("amount", 5000, "seller_name", "5000"));

        assertThat(evaluator.matches(Condition.leaf("amount", "==", "5000"), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("seller_name", "==", 5000), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("seller_name", ">", 10), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("amount", "contains", "50"), record)).isFalse();
    }

    @Test
    @DisplayName("Should fail every leaf whose record value is missing")
    void shouldFailOnMissingValue() {
        Map<String, Object> features = new HashMap<>();
        features.put("agent_id", null);
        TransactionRecord record = record(features);

        assertThat(evaluator.matches(Condition.leaf("agent_id", "!=", "openai"), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("device", "not_in", List.of("web")), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("seller_name", "not_contains", "shop"), record)).isFalse();
    }

    @Test
    @DisplayName("Should evaluate membership and containment operators")
    void shouldEvaluateMembershipAndContainment() {
        TransactionRecord record = record(Map.of("device", "mobile", "seller_name", "Acme Gift Cards"));

        assertThat(evaluator.matches(Condition.leaf("device", "in", List.of("web", "mobile")), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("device", "not_in", List.of("web", "tablet")), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("device", "in", "mobile"), record)).isFalse();
        assertThat(evaluator.matches(Condition.leaf("seller_name", "contains", "Gift"), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("seller_name", "not_contains", "gift"), record)).isTrue();
        assertThat(evaluator.matches(Condition.leaf("device", "!=", "web"), record)).isTrue();
    }

    @Test
    @DisplayName("Should combine nested groups with AND and OR")
    void shouldEvaluateNestedGroups() {
        TransactionRecord record = record(Map.of("amount", 800, "device", "tablet", "flagged", true));
        Rule rule = Rule.of("tablet-or-flagged", "Review small tablet or flagged payments", Decision.REVIEW, null,
                Condition.leaf("amount", "<", 1000),
                Condition.any(
                        Condition.leaf("device", "==", "mobile"),
                        Condition.all(Condition.leaf("flagged", "==", true), Condition.leaf("device", "==", "tablet"))));

        assertThat(evaluator.matches(rule, record)).isTrue();
        assertThat(evaluator.decide(rule, record)).isEqualTo(Decision.REVIEW);
        assertThat(evaluator.decide(rule, record(Map.of("amount", 800, "device", "web", "flagged", true))))
                .isEqualTo(Decision.ALLOW);
    }

    @Test
    @DisplayName("Should treat a rule without conditions as never matching")
    void shouldNotMatchEmptyRule() {
        Rule rule = new Rule("empty-rule", "No conditions at all", "block", null, List.of());

        assertThat(evaluator.decide(rule, record(Map.of("amount", 1)))).isEqualTo(Decision.ALLOW);
    }
}
