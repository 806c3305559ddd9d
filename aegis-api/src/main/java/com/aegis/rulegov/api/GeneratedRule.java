/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.api.model.Rule;

public record GeneratedRule(Rule rule, GenerationMetadata metadata) {
}
