/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.pipeline;

import com.aegis.rulegov.analysis.OverlapAnalyzer;
import com.aegis.rulegov.api.ActiveRuleRegistry;
import com.aegis.rulegov.api.AuditLog;
import com.aegis.rulegov.api.GeneratedRule;
import com.aegis.rulegov.api.GenerationRequest;
import com.aegis.rulegov.api.RuleGenerator;
import com.aegis.rulegov.api.SuggestionRepository;
import com.aegis.rulegov.api.exceptions.CatalogViolationException;
import com.aegis.rulegov.api.exceptions.GenerationFailureException;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.exceptions.PolicyViolationException;
import com.aegis.rulegov.api.exceptions.SampleUnavailableException;
import com.aegis.rulegov.api.exceptions.StructuralException;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.AuditEntry.Action;
import com.aegis.rulegov.api.model.ImpactReport;
import com.aegis.rulegov.api.model.OverlapEntry;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.Sample;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.api.model.Violation;
import com.aegis.rulegov.evaluation.DryRunEngine;
import com.aegis.rulegov.governance.SuggestionTransitions;
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
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an analyst's instruction into a persisted pending suggestion.
 *
 * <p>Steps, in order: policy pre-check on the instruction, generation, structure validation,
 * catalog validation, policy post-check on the generated rule, sampling, dry run, overlap
 * analysis, persistence. Any blocking finding stops the chain before anything is persisted
 * and is recorded in the audit log. An unavailable sample does not stop it: the suggestion is
 * stored with the reason instead of an impact report, and cannot be approved.
 */
@ApplicationScoped
public class SuggestionPipeline {

    private static final Logger logger = Logger.getLogger(SuggestionPipeline.class.getName());

    static final int MIN_INSTRUCTION_LENGTH = 10;
    static final int MAX_SAMPLE_SIZE = 100_000;

    @Inject
    Tracer tracer;

    @Inject
    RuleGenerator generator;

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
    SuggestionRepository repository;

    @Inject
    AuditLog auditLog;

    @Inject
    SuggestionTransitions transitions;

    @Inject
    Clock clock;

    @ConfigProperty(name = "aegis.sample.size", defaultValue = "10000")
    int defaultSampleSize;

    public Suggestion submitSuggestion(String instruction, String authorId) {
        return submitSuggestion(instruction, authorId, SubmitOptions.defaults());
    }

    public Suggestion submitSuggestion(String instruction, String authorId, SubmitOptions options) {
        SubmitOptions opts = options == null ? SubmitOptions.defaults() : options;
        String author = authorId == null || authorId.isBlank() ? "unknown" : authorId.trim();
        if (instruction == null || instruction.trim().length() < MIN_INSTRUCTION_LENGTH) {
            throw new InvalidRequestException("Instruction must be at least " + MIN_INSTRUCTION_LENGTH + " characters");
        }
        int sampleSize = opts.sampleSizeOr(defaultSampleSize);
        if (sampleSize <= 0 || sampleSize > MAX_SAMPLE_SIZE) {
            throw new InvalidRequestException("Sample size must be between 1 and " + MAX_SAMPLE_SIZE);
        }

        Span span = tracer.spanBuilder("submit-suggestion").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("author", author);
            span.setAttribute("sampleSize", sampleSize);

            List<Violation> instructionFindings = policyGate.gateInstruction(instruction);
            if (PolicyGate.hasBlocking(instructionFindings)) {
                throw rejected(author, "instruction", null, instruction, null,
                        new PolicyViolationException(instructionFindings), PolicyGate.summarize(instructionFindings));
            }

            GeneratedRule generated = generate(instruction, author);
            Rule rule = generated.rule();
            span.setAttribute("ruleName", String.valueOf(rule.name()));

            ValidationResult structure = structureValidator.validate(rule);
            if (!structure.valid()) {
                throw rejected(author, "rule", rule.name(), instruction, rule,
                        new StructuralException(structure.errors()), Map.of("errors", structure.errorMessages()));
            }
            ValidationResult catalog = catalogValidator.validate(rule);
            if (!catalog.valid()) {
                throw rejected(author, "rule", rule.name(), instruction, rule,
                        new CatalogViolationException(catalog.errors()), Map.of("errors", catalog.errorMessages()));
            }
            ValidationResult validation = structure.merge(catalog);

            List<Violation> ruleFindings = policyGate.gateRule(rule);
            if (PolicyGate.hasBlocking(ruleFindings)) {
                throw rejected(author, "rule", rule.name(), instruction, rule,
                        new PolicyViolationException(ruleFindings), PolicyGate.summarize(ruleFindings));
            }
            List<Violation> warnings = new ArrayList<>(instructionFindings);
            warnings.addAll(ruleFindings);

            ImpactReport impact = null;
            String impactError = null;
            List<OverlapEntry> overlaps = List.of();
            try {
                Sample sample = step("sample", () -> sampler.sample(sampleSize, opts.filterOrNone()));
                impact = step("dry-run", () -> dryRunEngine.dryRun(rule, sample));
                overlaps = step("overlap", () -> overlapAnalyzer.analyze(rule, sample, activeRules.findEnabled()));
            } catch (SampleUnavailableException e) {
                logger.warning("Impact could not be computed for '" + rule.name() + "': " + e.getMessage());
                impactError = e.getMessage();
            }

            Instant now = clock.instant();
            Suggestion suggestion = Suggestion.pending(UUID.randomUUID().toString(), instruction, rule, validation,
                    warnings, impact, impactError, overlaps, generated.metadata(), author, now,
                    transitions.expiryFor(now));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("rule_name", rule.name());
            payload.put("readiness", suggestion.readiness());
            payload.put("impact_computed", suggestion.impactComputed());
            if (impact != null) {
                payload.put("match_rate", impact.matchRate());
                payload.put("false_positive_risk", impact.falsePositiveRisk().level().wire());
            }
            if (generated.metadata() != null) {
                payload.put("prompt_hash", generated.metadata().promptHash());
            }
            repository.insert(suggestion, AuditEntry.success(UUID.randomUUID().toString(), author,
                    Action.SUGGEST_RULE, "suggestion", suggestion.id(), payload, now));

            span.setAttribute("suggestionId", suggestion.id());
            logger.info("Suggestion " + suggestion.id() + " created by " + author + " (" + suggestion.readiness() + ")");
            return suggestion;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private GeneratedRule generate(String instruction, String author) {
        try {
            return step("generate", () -> generator.generate(new GenerationRequest(instruction, author)));
        } catch (GenerationFailureException e) {
            logger.warning("Generation failed (" + e.reason() + ") for prompt " + e.promptHash());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reason", e.reason().name());
            payload.put("prompt_hash", e.promptHash());
            audit(AuditEntry.failure(UUID.randomUUID().toString(), author, Action.GENERATION_FAILED,
                    "instruction", null, payload, e.getMessage(), clock.instant()), e);
            throw e;
        }
    }

    private RuntimeException rejected(String author, String resourceType, String resourceId, String instruction,
                                      Rule rule, RuntimeException failure, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instruction", instruction);
        if (rule != null) {
            payload.put("rule", rule);
        }
        payload.put("findings", details);
        audit(AuditEntry.failure(UUID.randomUUID().toString(), author, Action.SUGGEST_RULE_REJECTED,
                resourceType, resourceId, payload, failure.getMessage(), clock.instant()), failure);
        logger.info("Suggestion rejected for " + author + ": " + failure.getMessage());
        return failure;
    }

    private void audit(AuditEntry entry, RuntimeException original) {
        try {
            auditLog.append(entry);
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not record " + entry.action().wire() + " audit entry", e);
            original.addSuppressed(e);
        }
    }

    private <T> T step(String name, Supplier<T> work) {
        Span span = tracer.spanBuilder(name).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return work.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
