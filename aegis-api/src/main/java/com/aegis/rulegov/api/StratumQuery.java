/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.SampleFilter;
import com.aegis.rulegov.api.model.Stratum;
import com.aegis.rulegov.api.model.TransactionRecord;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * One stratum's share of a sample request.
 *
 * <p>{@link #matches(TransactionRecord)} is the reference predicate; SQL-backed stores must
 * select the same population.
 *
 * @param stratum            slice to draw from
 * @param since              lower bound on the record timestamp
 * @param limit              maximum records to return
 * @param filter             additional narrowing, never null
 * @param highValueThreshold minimum amount for {@link Stratum#HIGH_VALUE}
 * @param businessHoursStart first business hour (inclusive) for {@link Stratum#WEEKEND_OFF_HOURS}
 * @param businessHoursEnd   first off hour after business hours
 */
public record StratumQuery(
        Stratum stratum,
        Instant since,
        int limit,
        SampleFilter filter,
        double highValueThreshold,
        int businessHoursStart,
        int businessHoursEnd
) {
    public StratumQuery {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        filter = filter == null ? SampleFilter.none() : filter;
    }

    public boolean matches(TransactionRecord record) {
        if (record.timestamp() == null || record.timestamp().isBefore(since) || !filter.matches(record)) {
            return false;
        }
        return switch (stratum) {
            case RECENT, RANDOM -> true;
            case WEEKEND_OFF_HOURS -> isWeekendOrOffHours(record);
            case FLAGGED_DISPUTED -> record.isFlaggedOrDisputed();
            case HIGH_VALUE -> record.amount() >= highValueThreshold;
        };
    }

    private boolean isWeekendOrOffHours(TransactionRecord record) {
        ZonedDateTime at = record.timestamp().atZone(ZoneOffset.UTC);
        DayOfWeek day = at.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return true;
        }
        int hour = record.feature("hour") instanceof Number n ? n.intValue() : at.getHour();
        return hour < businessHoursStart || hour >= businessHoursEnd;
    }
}
