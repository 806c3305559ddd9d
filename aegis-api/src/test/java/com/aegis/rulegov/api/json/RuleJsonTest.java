package com.aegis.rulegov.api.json;

import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.ConditionValue;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.Rule;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleJsonTest {

    private final ObjectMapper mapper = RuleJson.mapper();

    @Test
    @DisplayName("Should read leaves and nested groups with typed values")
    void shouldReadConditionTree() throws Exception {
        String json = """
                {
                  "ruleset_name": "mobile-high-value",
                  "description": "Review large mobile purchases",
                  "decision": "review",
                  "category": "high_risk",
                  "conditions": [
                    {"field": "amount", "op": ">", "value": 5000},
                    {"any": [
                      {"field": "device", "op": "==", "value": "mobile"},
                      {"field": "partner", "op": "in", "value": ["amazon", "shopify"]}
                    ]}
                  ]
                }
                """;

        Rule rule = mapper.readValue(json, Rule.class);

        assertThat(rule.name()).isEqualTo("mobile-high-value");
        assertThat(rule.resolvedDecision()).contains(Decision.REVIEW);
        assertThat(rule.conditions()).hasSize(2);
        assertThat(rule.leafCount()).isEqualTo(3);

        Condition.Leaf amount = (Condition.Leaf) rule.conditions().get(0);
        assertThat(amount.value()).isEqualTo(new ConditionValue.Num(new BigDecimal("5000")));

        Condition.Any any = (Condition.Any) rule.conditions().get(1);
        Condition.Leaf partner = (Condition.Leaf) any.conditions().get(1);
        assertThat(partner.value()).isInstanceOf(ConditionValue.ListOf.class);
        assertThat(((ConditionValue.ListOf) partner.value()).items()).hasSize(2);
    }

    @Test
    @DisplayName("Should keep null condition entries for validation to report")
    void shouldKeepNullConditionEntries() throws Exception {
        String json = """
                {
                  "ruleset_name": "null-entries",
                  "description": "Rule with missing condition entries",
                  "decision": "review",
                  "conditions": [null, {"all": [{"field": "amount", "op": ">", "value": 100}, null]}]
                }
                """;

        Rule rule = mapper.readValue(json, Rule.class);

        assertThat(rule.conditions()).hasSize(2);
        assertThat(rule.conditions().get(0)).isNull();
        assertThat(((Condition.All) rule.conditions().get(1)).conditions()).hasSize(2).last().isNull();
        assertThat(rule.leafCount()).isEqualTo(1);
        assertThat(rule.leaves()).hasSize(1);
        assertThat(mapper.writeValueAsString(rule)).contains("\"conditions\":[null,{\"all\":[");
    }

    @Test
    @DisplayName("Should distinguish a JSON null value from a missing value")
    void shouldDistinguishNullFromMissing() throws Exception {
        String json = """
                [{"field": "device", "op": "==", "value": null},
                 {"field": "device", "op": "=="}]
                """;

        Condition[] conditions = mapper.readValue(json, Condition[].class);

        assertThat(((Condition.Leaf) conditions[0]).value()).isEqualTo(ConditionValue.NULL);
        assertThat(((Condition.Leaf) conditions[1]).value()).isNull();
    }

    @Test
    @DisplayName("Should not coerce numeric strings into numbers")
    void shouldKeepStringsAsText() throws Exception {
        Condition condition = mapper.readValue("{\"field\":\"amount\",\"op\":\">\",\"value\":\"5000\"}",
                Condition.class);

        assertThat(((Condition.Leaf) condition).value()).isEqualTo(new ConditionValue.Text("5000"));
    }

    @Test
    @DisplayName("Should accept 'operator' as an alias of 'op'")
    void shouldAcceptOperatorAlias() throws Exception {
        Condition condition = mapper.readValue("{\"field\":\"hour\",\"operator\":\"<\",\"value\":6}",
                Condition.class);

        assertThat(((Condition.Leaf) condition).op()).isEqualTo("<");
    }

    @Test
    @DisplayName("Should fail on object literals")
    void shouldRejectObjectValues() {
        assertThatThrownBy(() -> mapper.readValue(
                "{\"field\":\"amount\",\"op\":\"==\",\"value\":{\"x\":1}}", Condition.class))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("Unsupported condition value");
    }

    @Test
    @DisplayName("Should write rules back in the same shape")
    void shouldWriteRule() throws Exception {
        Rule rule = Rule.of("night-block", "Block night transfers over limit", Decision.BLOCK, null,
                Condition.leaf("hour", "<", 6),
                Condition.all(Condition.leaf("intent", "==", "transfer")));

        String json = mapper.writeValueAsString(rule);

        assertThat(json)
                .contains("\"ruleset_name\":\"night-block\"")
                .contains("{\"field\":\"hour\",\"op\":\"<\",\"value\":6}")
                .contains("{\"all\":[{\"field\":\"intent\",\"op\":\"==\",\"value\":\"transfer\"}]}");
        assertThat(mapper.readValue(json, Rule.class)).isEqualTo(rule);
    }
}
