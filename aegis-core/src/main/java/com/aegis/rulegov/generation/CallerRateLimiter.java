/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.generation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window rate limit per caller.
 *
 * <p>Windows live in a Caffeine cache that forgets idle callers after one window length, so
 * the limiter does not grow with the number of distinct callers.
 */
public class CallerRateLimiter {

    private final int permits;
    private final long windowMillis;
    private final Clock clock;
    private final Cache<String, Deque<Long>> windows;

    public CallerRateLimiter(int permits, Duration window, Clock clock) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be positive");
        }
        this.permits = permits;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(window)
                .maximumSize(100_000)
                .build();
    }

    /**
     * Records a call for {@code callerId} if the caller still has room in the current window.
     *
     * @return false when the call must be refused
     */
    public boolean tryAcquire(String callerId) {
        Deque<Long> calls = windows.get(callerId, k -> new ArrayDeque<>());
        long now = clock.millis();
        synchronized (calls) {
            while (!calls.isEmpty() && now - calls.peekFirst() >= windowMillis) {
                calls.pollFirst();
            }
            if (calls.size() >= permits) {
                return false;
            }
            calls.addLast(now);
            return true;
        }
    }
}
