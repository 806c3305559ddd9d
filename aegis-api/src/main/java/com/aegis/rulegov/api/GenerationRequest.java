/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

/**
 * @param instruction analyst's natural-language description of the rule
 * @param callerId    caller identity, used for rate limiting
 */
public record GenerationRequest(String instruction, String callerId) {
}
