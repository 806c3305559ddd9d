/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.evaluation;

import com.aegis.rulegov.api.exceptions.SampleUnavailableException;
import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.ImpactReport.ChangeExample;
import com.aegis.rulegov.api.model.ImpactReport.DecisionRates;
import com.aegis.rulegov.api.model.ImpactReport.FalsePositiveRisk;
import com.aegis.rulegov.api.model.ImpactReport.RiskLevel;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.Sample;
import com.aegis.rulegov.api.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Replays a proposed rule over a historical sample and compares decision distributions.
 *
 * <h2>Layering</h2>
 * <p>The proposed decision of a record is the more severe of its baseline decision and the
 * decision of the rule alone ({@code block > review > allow}), so a new rule never downgrades
 * an existing block.
 *
 * <h2>False-positive risk</h2>
 * <p>Among records moved from allow to review or block, the share carrying neither a fraud
 * flag nor a dispute: above 70% is high, above 40% medium, otherwise low.
 *
 * <p>Samples larger than {@code parallelThreshold} are evaluated on a parallel stream.
 */
public class DryRunEngine {
    private static final Logger logger = LoggerFactory.getLogger(DryRunEngine.class);

    public static final int DEFAULT_PARALLEL_THRESHOLD = 5_000;
    public static final int MAX_EXAMPLES = 10;

    static final double HIGH_RISK_RATE = 70.0;
    static final double MEDIUM_RISK_RATE = 40.0;

    private static final Comparator<ImpactTally.Change> BY_AMOUNT_DESC =
            Comparator.comparingDouble((ImpactTally.Change c) -> c.record().amount()).reversed()
                    .thenComparing(c -> c.record().id());

    private final ConditionEvaluator evaluator;
    private final UnaryOperator<TransactionRecord> redactor;
    private final int parallelThreshold;
    private final Clock clock;

    /**
     * @param evaluator         condition evaluator
     * @param redactor          applied to every record before it becomes a change example
     * @param parallelThreshold sample size above which evaluation runs in parallel
     * @param clock             source of {@code computedAt}
     */
    public DryRunEngine(ConditionEvaluator evaluator, UnaryOperator<TransactionRecord> redactor,
                        int parallelThreshold, Clock clock) {
        this.evaluator = evaluator;
        this.redactor = redactor;
        this.parallelThreshold = parallelThreshold;
        this.clock = clock;
    }

    public DryRunEngine(ConditionEvaluator evaluator, UnaryOperator<TransactionRecord> redactor) {
        this(evaluator, redactor, DEFAULT_PARALLEL_THRESHOLD, Clock.systemUTC());
    }

    public ImpactReport dryRun(Rule rule, Sample sample) {
        if (sample == null || sample.isEmpty()) {
            throw new SampleUnavailableException("Impact could not be computed: sample is empty");
        }
        long start = System.nanoTime();
        List<TransactionRecord> records = sample.records();

        ImpactTally tally;
        if (records.size() > parallelThreshold) {
            tally = records.parallelStream().collect(ImpactTally::new,
                    (t, record) -> t.add(record, evaluator.decide(rule, record)),
                    ImpactTally::combine);
        } else {
            tally = new ImpactTally();
            for (TransactionRecord record : records) {
                tally.add(record, evaluator.decide(rule, record));
            }
        }

        int total = tally.total();
        DecisionRates baseline = rates(tally.baseline, total);
        DecisionRates proposed = rates(tally.proposed, total);

        List<ChangeExample> examples = tally.changes.stream()
                .sorted(BY_AMOUNT_DESC)
                .limit(MAX_EXAMPLES)
                .map(this::toExample)
                .toList();

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        logger.debug("Dry run of '{}' over {} records: {} matches, {} changes in {}ms",
                rule.name(), total, tally.matches, tally.changes.size(), elapsedMillis);

        return new ImpactReport(
                total,
                tally.matches,
                DecisionRates.percent(tally.matches, total),
                tally.changes.size(),
                DecisionRates.percent(tally.changes.size(), total),
                baseline,
                proposed,
                proposed.minus(baseline),
                examples,
                falsePositiveRisk(tally.unflaggedCaught, tally.totalCaught),
                sample.stratumSummary(),
                elapsedMillis,
                Instant.now(clock));
    }

    static FalsePositiveRisk falsePositiveRisk(int unflaggedCaught, int totalCaught) {
        if (totalCaught == 0) {
            return new FalsePositiveRisk(RiskLevel.LOW, 0, 0, 0.0, null);
        }
        double rate = DecisionRates.percent(unflaggedCaught, totalCaught);
        if (rate > HIGH_RISK_RATE) {
            return new FalsePositiveRisk(RiskLevel.HIGH, unflaggedCaught, totalCaught, rate,
                    "High false positive risk - rule may be too aggressive");
        }
        if (rate > MEDIUM_RISK_RATE) {
            return new FalsePositiveRisk(RiskLevel.MEDIUM, unflaggedCaught, totalCaught, rate,
                    "Moderate false positive risk - check the change examples before approving");
        }
        return new FalsePositiveRisk(RiskLevel.LOW, unflaggedCaught, totalCaught, rate, null);
    }

    private ChangeExample toExample(ImpactTally.Change change) {
        TransactionRecord redacted = redactor.apply(change.record());
        Object device = redacted.feature("device");
        return new ChangeExample(redacted.id(), redacted.amount(), device == null ? null : device.toString(),
                change.baseline(), change.proposed());
    }

    private static DecisionRates rates(int[] counts, int total) {
        return DecisionRates.fromCounts(counts[Decision.ALLOW.ordinal()], counts[Decision.REVIEW.ordinal()],
                counts[Decision.BLOCK.ordinal()], total);
    }
}
