/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api;

import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.RuleVersion;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the live rule set and its history.
 *
 * <p>Rules enter the set only through an approved suggestion; see
 * {@link SuggestionRepository#approve}.
 */
public interface ActiveRuleRegistry {

    List<ActiveRule> findEnabled();

    Optional<ActiveRule> findById(String ruleId);

    List<RuleVersion> findVersions(String ruleId);
}
