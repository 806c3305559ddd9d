/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.TransactionRecord;

import java.util.List;

/**
 * Read-only access to historical transactions.
 *
 * <p>Implementations throw an unchecked exception when the store is unreachable; the sampler
 * turns that into {@link com.aegis.rulegov.api.exceptions.SampleUnavailableException}.
 */
public interface TransactionRecordStore {

    /**
     * Returns up to {@code query.limit()} records of the requested stratum.
     * {@link com.aegis.rulegov.api.model.Stratum#RECENT} is newest first,
     * {@link com.aegis.rulegov.api.model.Stratum#RANDOM} is in random order.
     */
    List<TransactionRecord> query(StratumQuery query);
}
