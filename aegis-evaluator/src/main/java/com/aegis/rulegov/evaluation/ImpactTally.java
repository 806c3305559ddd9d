/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.evaluation;

import com.aegis.rulegov.api.model.Decision;
import com.aegis.rulegov.api.model.TransactionRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable accumulator for one dry run. {@link #combine(ImpactTally)} is commutative, so
 * partial tallies from a parallel stream can be merged in any order.
 */
final class ImpactTally {

    /** A record whose final decision differs from its baseline. */
    record Change(TransactionRecord record, Decision baseline, Decision proposed) {
    }

    final int[] baseline = new int[Decision.values().length];
    final int[] proposed = new int[Decision.values().length];
    int matches;
    int unflaggedCaught;
    int totalCaught;
    final List<Change> changes = new ArrayList<>();

    void add(TransactionRecord record, Decision ruleAlone) {
        Decision before = record.baselineDecision();
        Decision after = Decision.mostSevere(before, ruleAlone);

        baseline[before.ordinal()]++;
        proposed[after.ordinal()]++;
        if (ruleAlone != Decision.ALLOW) {
            matches++;
        }
        if (after != before) {
            changes.add(new Change(record, before, after));
            if (before == Decision.ALLOW) {
                totalCaught++;
                if (!record.isFlaggedOrDisputed()) {
                    unflaggedCaught++;
                }
            }
        }
    }

    void combine(ImpactTally other) {
        for (int i = 0; i < baseline.length; i++) {
            baseline[i] += other.baseline[i];
            proposed[i] += other.proposed[i];
        }
        matches += other.matches;
        unflaggedCaught += other.unflaggedCaught;
        totalCaught += other.totalCaught;
        changes.addAll(other.changes);
    }

    int total() {
        int total = 0;
        for (int count : baseline) {
            total += count;
        }
        return total;
    }
}
