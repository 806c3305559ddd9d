/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.impact;

import com.aegis.rulegov.analysis.OverlapAnalyzer;
import com.aegis.rulegov.analysis.OverlapExample;
import com.aegis.rulegov.api.ActiveRuleRegistry;
import com.aegis.rulegov.api.AuditLog;
import com.aegis.rulegov.api.exceptions.CatalogViolationException;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.exceptions.PolicyViolationException;
import com.aegis.rulegov.api.exceptions.StructuralException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.AuditEntry.Action;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.OverlapEntry;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Sample;
import com.aegis.rulegov.api.model.SampleFilter;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.api.model.Violation;
import com.aegis.rulegov.evaluation.DryRunEngine;
import com.aegis.rulegov.policy.PolicyGate;
import com.aegis.rulegov.sampling.StratifiedSampler;
import com.aegis.rulegov.validation.CatalogValidator;
import com.aegis.rulegov.validation.RuleStructureValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Manual what-if analysis of a hand-written rule. Nothing is persisted except the audit entry.
 */
@ApplicationScoped
public class ImpactService {

    private static final Logger logger = Logger.getLogger(ImpactService.class.getName());

    static final int MAX_SAMPLE_SIZE = 100_000;
    static final int MAX_OVERLAP_EXAMPLES = 20;

    @Inject
    Tracer tracer;

    @Inject
    RuleStructureValidator structureValidator;

    @Inject
    CatalogValidator catalogValidator;

    @Inject
    PolicyGate policyGate;

    @Inject
    StratifiedSampler sampler;

    @Inject
    DryRunEngine dryRunEngine;

    @Inject
    OverlapAnalyzer overlapAnalyzer;

    @Inject
    ActiveRuleRegistry activeRules;

    @Inject
    AuditLog auditLog;

    @Inject
    Clock clock;

    public DryRunResult dryRun(Rule rule, int sampleSize) {
        return dryRun(rule, sampleSize, SampleFilter.none(), "unknown");
    }

    /**
     * Validates the rule, then replays it over a fresh stratified sample and compares it with
     * the enabled rules.
     *
     * @throws StructuralException        the rule is malformed
     * @throws CatalogViolationException  the rule does not fit the catalog
     * @throws PolicyViolationException   the rule uses a disallowed field
     * @throws com.aegis.rulegov.api.exceptions.SampleUnavailableException no sample could be drawn
     */
    public DryRunResult dryRun(Rule rule, int sampleSize, SampleFilter filter, String actor) {
        if (rule == null) {
            throw new InvalidRequestException("Rule is required");
        }
        requireSampleSize(sampleSize);

        Span span = tracer.spanBuilder("dry-run").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleName", String.valueOf(rule.name()));
            span.setAttribute("sampleSize", sampleSize);

            ValidationResult validation = validate(rule);
            List<Violation> violations = policyGate.gateRule(rule);
            if (PolicyGate.hasBlocking(violations)) {
                throw new PolicyViolationException(violations);
            }

            Sample sample = sampler.sample(sampleSize, filter == null ? SampleFilter.none() : filter);
            ImpactReport impact = dryRunEngine.dryRun(rule, sample);
            List<OverlapEntry> overlaps = overlapAnalyzer.analyze(rule, sample, activeRules.findEnabled());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sample_size", impact.sampleSize());
            payload.put("match_rate", impact.matchRate());
            payload.put("change_count", impact.changeCount());
            payload.put("overlaps", overlaps.size());
            auditLog.append(AuditEntry.success(UUID.randomUUID().toString(), actor == null ? "unknown" : actor,
                    Action.DRY_RUN, "rule", rule.name(), payload, clock.instant()));

            logger.fine(() -> "Dry run of '" + rule.name() + "': match rate " + impact.matchRate() + "%");
            return new DryRunResult(validation, violations, impact, overlaps);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Sample records both the proposed rule and an active rule would catch, for judging whether
     * they are redundant.
     */
    public List<OverlapExample> overlapExamples(Rule rule, String activeRuleId, int sampleSize) {
        if (rule == null) {
            throw new InvalidRequestException("Rule is required");
        }
        requireSampleSize(sampleSize);
        ActiveRule existing = activeRules.findById(activeRuleId)
                .orElseThrow(() -> new InvalidRequestException("Unknown active rule: " + activeRuleId));
        validate(rule);
        Sample sample = sampler.sample(sampleSize);
        return overlapAnalyzer.examples(rule, existing.rule(), sample, MAX_OVERLAP_EXAMPLES);
    }

    public List<ActiveRule> activeRules() {
        return activeRules.findEnabled();
    }

    public Optional<ActiveRule> activeRule(String ruleId) {
        return activeRules.findById(ruleId);
    }

    public List<RuleVersion> ruleVersions(String ruleId) {
        return activeRules.findVersions(ruleId);
    }

    private ValidationResult validate(Rule rule) {
        ValidationResult structure = structureValidator.validate(rule);
        if (!structure.valid()) {
            throw new StructuralException(structure.errors());
        }
        ValidationResult catalog = catalogValidator.validate(rule);
        if (!catalog.valid()) {
            throw new CatalogViolationException(catalog.errors());
        }
        return structure.merge(catalog);
    }

    private static void requireSampleSize(int sampleSize) {
        if (sampleSize <= 0 || sampleSize > MAX_SAMPLE_SIZE) {
            throw new InvalidRequestException("Sample size must be between 1 and " + MAX_SAMPLE_SIZE);
        }
    }
}
