/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.generation;

import com.aegis.rulegov.api.GeneratedRule;
import com.aegis.rulegov.api.GenerationRequest;
import com.aegis.rulegov.api.RuleGenerator;
import com.aegis.rulegov.api.exceptions.GenerationFailureException;
import com.aegis.rulegov.api.exceptions.GenerationFailureException.Reason;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.support.ContentHash;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps a {@link RuleGenerator} with a response cache, a per-caller rate limit and a hard
 * timeout.
 *
 * <p>The cache is keyed by a SHA-256 hash of model and instruction, so identical instructions
 * reuse the earlier rule without another upstream call. Every failure mode surfaces as
 * {@link GenerationFailureException}; nothing is retried. Only the hash is logged, never the
 * instruction text.
 */
public class GuardedRuleGenerator implements RuleGenerator {

    private static final Logger logger = Logger.getLogger(GuardedRuleGenerator.class.getName());

    private final RuleGenerator delegate;
    private final GenerationSettings settings;
    private final Executor executor;
    private final CallerRateLimiter rateLimiter;
    private final Cache<String, GeneratedRule> cache;

    public GuardedRuleGenerator(RuleGenerator delegate, GenerationSettings settings, Executor executor, Clock clock) {
        this.delegate = delegate;
        this.settings = settings;
        this.executor = executor;
        this.rateLimiter = new CallerRateLimiter(settings.requestsPerWindow(), settings.window(), clock);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(settings.cacheTtl())
                .maximumSize(settings.cacheMaxSize())
                .build();
    }

    public String promptHash(String instruction) {
        return ContentHash.sha256(settings.model() + ":" + instruction.trim());
    }

    @Override
    public GeneratedRule generate(GenerationRequest request) {
        String instruction = request.instruction();
        if (instruction == null || instruction.trim().length() < settings.minInstructionLength()) {
            throw new InvalidRequestException("Instruction must be at least "
                    + settings.minInstructionLength() + " characters");
        }
        String hash = promptHash(instruction);

        GeneratedRule cached = cache.getIfPresent(hash);
        if (cached != null) {
            logger.fine(() -> "Generation cache hit for prompt " + hash);
            return new GeneratedRule(cached.rule(), cached.metadata().asCached());
        }

        String caller = request.callerId() == null ? "anonymous" : request.callerId();
        if (!rateLimiter.tryAcquire(caller)) {
            logger.warning("Generation rate limit exceeded for caller " + caller);
            throw new GenerationFailureException(Reason.RATE_LIMITED, hash,
                    "Rate limit exceeded: at most " + settings.requestsPerWindow() + " generations per "
                            + settings.window().toSeconds() + "s");
        }

        GeneratedRule result = callWithTimeout(request, hash);
        if (result == null || result.rule() == null) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, hash, "Generator returned no rule");
        }

        GenerationMetadata metadata = result.metadata();
        GeneratedRule normalized = new GeneratedRule(result.rule(), metadata == null
                ? new GenerationMetadata(settings.model(), hash, false, 0L, 0)
                : new GenerationMetadata(metadata.model(), hash, false, metadata.latencyMillis(),
                metadata.totalTokens()));
        cache.put(hash, normalized);
        return normalized;
    }

    private GeneratedRule callWithTimeout(GenerationRequest request, String hash) {
        CompletableFuture<GeneratedRule> call = CompletableFuture.supplyAsync(() -> delegate.generate(request), executor);
        try {
            return call.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            logger.warning("Generation timed out after " + settings.timeout().toMillis() + "ms for prompt " + hash);
            throw new GenerationFailureException(Reason.TIMEOUT, hash,
                    "Rule generation timed out after " + settings.timeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new GenerationFailureException(Reason.TIMEOUT, hash, "Rule generation was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationFailureException failure) {
                if (failure.promptHash() != null) {
                    throw failure;
                }
                throw new GenerationFailureException(failure.reason(), hash, failure.getMessage(), failure);
            }
            logger.log(Level.WARNING, "Generation failed for prompt " + hash, cause);
            throw new GenerationFailureException(Reason.UPSTREAM_ERROR, hash,
                    "Rule generation failed: " + cause.getMessage(), cause);
        }
    }
}
