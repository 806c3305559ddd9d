/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.generation;

import java.time.Duration;

/**
 * Limits applied around the rule generation call.
 *
 * @param model              model identifier, part of the cache key
 * @param timeout            hard upper bound on one generation call
 * @param requestsPerWindow  calls allowed per caller within {@code window}
 * @param window             rate limit window
 * @param cacheTtl           how long a generated rule is reused for the same instruction
 * @param cacheMaxSize       maximum cached instructions
 * @param minInstructionLength instructions shorter than this are refused before any call
 */
public record GenerationSettings(
        String model,
        Duration timeout,
        int requestsPerWindow,
        Duration window,
        Duration cacheTtl,
        long cacheMaxSize,
        int minInstructionLength
) {
    public static GenerationSettings defaults(String model) {
        return new GenerationSettings(model, Duration.ofSeconds(20), 10, Duration.ofMinutes(1),
                Duration.ofMinutes(30), 1_000, 10);
    }
}
