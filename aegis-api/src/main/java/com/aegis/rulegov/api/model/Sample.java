/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated stratified sample. Each record appears once, tagged with the stratum that
 * contributed it first.
 *
 * @param entries       sampled records in stratum order
 * @param requestedSize size the caller asked for; the sample may be smaller
 */
public record Sample(List<Entry> entries, int requestedSize) {

    public record Entry(TransactionRecord record, Stratum stratum) {
    }

    public Sample {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public TransactionRecord record(int index) {
        return entries.get(index).record();
    }

    public List<TransactionRecord> records() {
        return entries.stream().map(Entry::record).toList();
    }

    public Map<Stratum, Integer> stratumCounts() {
        Map<Stratum, Integer> counts = new EnumMap<>(Stratum.class);
        for (Stratum stratum : Stratum.values()) {
            counts.put(stratum, 0);
        }
        for (Entry entry : entries) {
            counts.merge(entry.stratum(), 1, Integer::sum);
        }
        return counts;
    }

    /** Stratum counts keyed by wire name, for reports. */
    public Map<String, Integer> stratumSummary() {
        Map<String, Integer> summary = new LinkedHashMap<>();
        stratumCounts().forEach((stratum, count) -> summary.put(stratum.wire(), count));
        return summary;
    }
}
