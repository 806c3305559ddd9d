/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.sampling;

import com.aegis.rulegov.api.model.Stratum;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stratum shares and look-back windows for {@link StratifiedSampler}.
 *
 * @param shares             fraction of the requested size per stratum, summing to 1
 * @param windows            how far back each stratum looks
 * @param highValueThreshold minimum amount of a high-value record
 * @param businessHoursStart first business hour, inclusive
 * @param businessHoursEnd   first off hour after business
 */
public record SamplerSettings(
        Map<Stratum, Double> shares,
        Map<Stratum, Duration> windows,
        double highValueThreshold,
        int businessHoursStart,
        int businessHoursEnd
) {
    public SamplerSettings {
        for (Stratum stratum : Stratum.values()) {
            if (!shares.containsKey(stratum) || !windows.containsKey(stratum)) {
                throw new IllegalArgumentException("Missing share or window for stratum " + stratum.wire());
            }
        }
        double sum = shares.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Stratum shares must sum to 1, got " + sum);
        }
        if (businessHoursStart < 0 || businessHoursEnd > 24 || businessHoursStart >= businessHoursEnd) {
            throw new IllegalArgumentException("Invalid business hours: " + businessHoursStart + "-" + businessHoursEnd);
        }
        shares = Collections.unmodifiableMap(new EnumMap<>(shares));
        windows = Collections.unmodifiableMap(new EnumMap<>(windows));
    }

    public static SamplerSettings defaults() {
        return withShares(0.30, 0.15, 0.20, 0.15, 0.20);
    }

    /**
     * Default windows and thresholds with custom shares, in {@link Stratum} declaration order.
     */
    public static SamplerSettings withShares(double recent, double weekendOffHours, double flaggedDisputed,
                                             double highValue, double random) {
        Map<Stratum, Double> shares = new EnumMap<>(Stratum.class);
        shares.put(Stratum.RECENT, recent);
        shares.put(Stratum.WEEKEND_OFF_HOURS, weekendOffHours);
        shares.put(Stratum.FLAGGED_DISPUTED, flaggedDisputed);
        shares.put(Stratum.HIGH_VALUE, highValue);
        shares.put(Stratum.RANDOM, random);

        Map<Stratum, Duration> windows = new EnumMap<>(Stratum.class);
        windows.put(Stratum.RECENT, Duration.ofDays(30));
        windows.put(Stratum.WEEKEND_OFF_HOURS, Duration.ofDays(30));
        windows.put(Stratum.FLAGGED_DISPUTED, Duration.ofDays(60));
        windows.put(Stratum.HIGH_VALUE, Duration.ofDays(60));
        windows.put(Stratum.RANDOM, Duration.ofDays(90));

        return new SamplerSettings(shares, windows, 5_000, 9, 18);
    }

    /**
     * Splits {@code size} across strata. Each stratum gets the floor of its share; the
     * rounding remainder goes to {@link Stratum#RANDOM}, so the targets add up to {@code size}.
     */
    public Map<Stratum, Integer> allocate(int size) {
        Map<Stratum, Integer> targets = new EnumMap<>(Stratum.class);
        int assigned = 0;
        for (Stratum stratum : Stratum.values()) {
            int target = (int) Math.floor(size * shares.get(stratum) + 1e-9);
            targets.put(stratum, target);
            assigned += target;
        }
        targets.merge(Stratum.RANDOM, size - assigned, Integer::sum);
        return targets;
    }
}
