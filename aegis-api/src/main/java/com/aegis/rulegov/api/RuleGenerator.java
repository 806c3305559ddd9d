/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

/**
 * Turns a natural-language instruction into a structured rule proposal.
 *
 * <p>Implementations must either return a fully parsed {@link GeneratedRule} or throw
 * {@link com.aegis.rulegov.api.exceptions.GenerationFailureException}. A partially populated
 * rule is never returned.
 */
public interface RuleGenerator {

    GeneratedRule generate(GenerationRequest request);
}
