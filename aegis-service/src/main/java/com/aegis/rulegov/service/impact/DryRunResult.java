/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.impact;

import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.OverlapEntry;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.api.model.Violation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a standalone what-if run.
 */
public record DryRunResult(
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("violations") List<Violation> violations,
        @JsonProperty("impact") ImpactReport impact,
        @JsonProperty("overlaps") List<OverlapEntry> overlaps
) {
    public DryRunResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        overlaps = overlaps == null ? List.of() : List.copyOf(overlaps);
    }
}
