/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.governance;

import java.time.Duration;

/**
 * @param minNotesLength minimum length of approval and rejection notes, after trimming
 * @param suggestionTtl  how long a suggestion stays pending before the sweep expires it
 */
public record GovernanceSettings(int minNotesLength, Duration suggestionTtl) {

    public static final GovernanceSettings DEFAULTS = new GovernanceSettings(10, Duration.ofDays(7));

    public GovernanceSettings {
        if (minNotesLength < 1) {
            throw new IllegalArgumentException("minNotesLength must be positive");
        }
        if (suggestionTtl == null || suggestionTtl.isNegative() || suggestionTtl.isZero()) {
            throw new IllegalArgumentException("suggestionTtl must be positive");
        }
    }
}
