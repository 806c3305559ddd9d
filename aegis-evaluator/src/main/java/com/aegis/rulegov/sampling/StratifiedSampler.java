/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.sampling;

import com.aegis.rulegov.api.StratumQuery;
import com.aegis.rulegov.api.TransactionRecordStore;
import com.aegis.rulegov.api.exceptions.SampleUnavailableException;
import com.aegis.rulegov.api.model.Sample;
import com.aegis.rulegov.api.model.SampleFilter;
import com.aegis.rulegov.api.model.Stratum;
import com.aegis.rulegov.api.model.TransactionRecord;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Draws a stratified sample of historical transactions.
 *
 * <p>The requested size is split across five strata (recent, weekend or off-hours,
 * flagged or disputed, high-value, random). Strata are queried concurrently and unioned
 * in declaration order; a record found by several strata keeps the tag of the first.
 * Shortfalls are not redistributed, so the sample may be smaller than requested.
 */
public class StratifiedSampler {
    private static final Logger logger = LoggerFactory.getLogger(StratifiedSampler.class);

    private final TransactionRecordStore store;
    private final SamplerSettings settings;
    private final Executor executor;
    private final Clock clock;

    public StratifiedSampler(TransactionRecordStore store, SamplerSettings settings, Executor executor, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.executor = executor;
        this.clock = clock;
    }

    public Sample sample(int size) {
        return sample(size, SampleFilter.none());
    }

    /**
     * @throws SampleUnavailableException if any stratum query fails or the union is empty
     */
    public Sample sample(int size, SampleFilter filter) {
        if (size <= 0) {
            throw new IllegalArgumentException("Sample size must be positive, got " + size);
        }
        Instant now = Instant.now(clock);
        Map<Stratum, Integer> targets = settings.allocate(size);

        Map<Stratum, CompletableFuture<List<TransactionRecord>>> pending = new EnumMap<>(Stratum.class);
        for (Stratum stratum : Stratum.values()) {
            StratumQuery query = new StratumQuery(stratum, now.minus(settings.windows().get(stratum)),
                    targets.get(stratum), filter, settings.highValueThreshold(),
                    settings.businessHoursStart(), settings.businessHoursEnd());
            pending.put(stratum, query.limit() == 0
                    ? CompletableFuture.completedFuture(List.of())
                    : CompletableFuture.supplyAsync(() -> store.query(query), executor));
        }

        List<Sample.Entry> entries = new ArrayList<>(size);
        ObjectSet<String> seen = new ObjectOpenHashSet<>(size);
        for (Map.Entry<Stratum, CompletableFuture<List<TransactionRecord>>> stratum : pending.entrySet()) {
            List<TransactionRecord> records;
            try {
                records = stratum.getValue().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                logger.warn("Stratum '{}' query failed: {}", stratum.getKey().wire(), cause.getMessage());
                throw new SampleUnavailableException(
                        "Transaction store unavailable while sampling " + stratum.getKey().wire(), cause);
            }
            for (TransactionRecord record : records) {
                if (seen.add(record.id())) {
                    entries.add(new Sample.Entry(record, stratum.getKey()));
                }
            }
        }

        if (entries.isEmpty()) {
            throw new SampleUnavailableException("No historical transactions available for sampling");
        }
        Sample sample = new Sample(entries, size);
        logger.debug("Sampled {} of {} requested records: {}", sample.size(), size, sample.stratumSummary());
        return sample;
    }
}
