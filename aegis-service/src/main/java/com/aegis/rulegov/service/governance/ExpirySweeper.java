/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */

package com.aegis.rulegov.service.governance;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically expires overdue pending suggestions. Expiry is never applied on read.
 */
@ApplicationScoped
public class ExpirySweeper {

    private static final Logger logger = Logger.getLogger(ExpirySweeper.class.getName());

    @Inject
    GovernanceService governanceService;

    @ConfigProperty(name = "aegis.governance.expiry-sweep-interval-seconds", defaultValue = "300")
    long intervalSeconds;

    private ScheduledExecutorService scheduler;

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("suggestion-expiry")
                .setDaemon(true)
                .build());
        scheduler.scheduleWithFixedDelay(this::sweep, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Suggestion expiry sweep every " + intervalSeconds + "s");
    }

    /**
     * One pass. Failures are logged and the next pass runs as scheduled.
     */
    int sweep() {
        try {
            return governanceService.expireDue();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            logger.log(Level.SEVERE, "Suggestion expiry sweep failed", e);
            return 0;
        }
    }

    public synchronized void shutdown() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}
