package com.aegis.rulegov.service;

import com.aegis.rulegov.api.StratumQuery;
import com.aegis.rulegov.api.TransactionRecordStore;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.Condition;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.ImpactReport.DecisionRates;
import com.aegis.rulegov.api.model.ImpactReport.FalsePositiveRisk;
import com.aegis.rulegov.api.model.ImpactReport.RiskLevel;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.RuleCategory;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.TransactionRecord;
import com.aegis.rulegov.api.model.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data for the service tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2025-03-12T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final Rule LARGE_MOBILE = Rule.of("large-mobile-review", "Review large mobile payments",
            Decision.REVIEW, RuleCategory.HIGH_RISK,
            Condition.leaf("amount", ">", 10000), Condition.leaf("device", "==", "mobile"));

    private Fixtures() {
    }

    public static TransactionRecord txn(String id, Instant at, double amount, String device, Decision baseline,
                                        boolean flagged) {
        Map<String, Object> features = new HashMap<>();
        features.put("amount", amount);
        features.put("hour", at.atZone(ZoneOffset.UTC).getHour());
        features.put("device", device);
        features.put("agent_id", "agent-" + id);
        features.put("partner", "stripe");
        features.put("flagged", flagged);
        features.put("disputed", false);
        features.put("declined", false);
        features.put("user_id", "user-" + id);
        return new TransactionRecord(id, at, baseline, features);
    }

    /**
     * Twenty allowed records from the last twenty days: amount {@code i * 1000}, mobile when
     * {@code i} is even, flagged when {@code i} is a multiple of five.
     */
    public static List<TransactionRecord> history() {
        List<TransactionRecord> records = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            records.add(txn("t" + i, NOW.minus(Duration.ofDays(i)), i * 1000.0,
                    i % 2 == 0 ? "mobile" : "web", Decision.ALLOW, i % 5 == 0));
        }
        return records;
    }

    /**
     * A store that answers stratum queries from a fixed list.
     */
    public static TransactionRecordStore storeOf(List<TransactionRecord> records) {
        return (StratumQuery query) -> records.stream()
                .filter(query::matches)
                .limit(query.limit())
                .toList();
    }

    public static ImpactReport impact() {
        DecisionRates baseline = new DecisionRates(100.0, 0.0, 0.0);
        DecisionRates proposed = new DecisionRates(75.0, 25.0, 0.0);
        return new ImpactReport(20, 5, 25.0, 5, 25.0, baseline, proposed, proposed.minus(baseline), List.of(),
                new FalsePositiveRisk(RiskLevel.HIGH, 4, 5, 80.0, "High false positive risk"),
                Map.of("recent", 20), 3L, NOW);
    }

    public static Suggestion pending(String id, String author) {
        return Suggestion.pending(id, "Review large mobile payments after midnight", LARGE_MOBILE,
                ValidationResult.ok(), List.of(), impact(), null, List.of(),
                new GenerationMetadata("test-model", "hash-" + id, false, 120L, 340), author,
                NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)));
    }

    public static AuditEntry audit(AuditEntry.Action action, String actor, String suggestionId) {
        return AuditEntry.success("audit-" + action.wire() + "-" + suggestionId, actor, action,
                "suggestion", suggestionId, Map.of(), NOW);
    }
}
