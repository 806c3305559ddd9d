package com.aegis.rulegov.service.lifecycle;

import com.aegis.rulegov.infra.telemetry.TracingService;
import com.aegis.rulegov.service.governance.ExpirySweeper;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Application lifecycle: starts the expiry sweep after the schema exists and flushes traces on
 * the way down.
 */
@ApplicationScoped
public class AegisLifecycle {

    private static final Logger logger = Logger.getLogger(AegisLifecycle.class.getName());

    @Inject
    ExpirySweeper expirySweeper;

    @Inject
    TracingService tracingService;

    void onStart(@Observes StartupEvent event) {
        logger.info("Starting Aegis rule governance");
        expirySweeper.start();
        logger.info("Aegis rule governance is ready to serve requests");
    }

    void onStop(@Observes ShutdownEvent event) {
        logger.info("Shutting down Aegis rule governance");
        expirySweeper.shutdown();
        tracingService.shutdown();
        logger.info("Aegis rule governance shutdown complete");
    }
}
