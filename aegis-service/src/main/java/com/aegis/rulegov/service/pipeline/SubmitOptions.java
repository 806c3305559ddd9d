/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.pipeline;

import com.aegis.rulegov.api.model.SampleFilter;

/**
 * Optional knobs for a submission.
 *
 * @param sampleSize records to replay the rule over, null for the configured default
 * @param filter     narrowing applied to every sampling stratum, null for none
 */
public record SubmitOptions(Integer sampleSize, SampleFilter filter) {

    private static final SubmitOptions DEFAULTS = new SubmitOptions(null, null);

    public static SubmitOptions defaults() {
        return DEFAULTS;
    }

    public int sampleSizeOr(int fallback) {
        return sampleSize == null ? fallback : sampleSize;
    }

    public SampleFilter filterOrNone() {
        return filter == null ? SampleFilter.none() : filter;
    }
}
