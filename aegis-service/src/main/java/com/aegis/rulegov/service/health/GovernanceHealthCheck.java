package com.aegis.rulegov.service.health;

import com.aegis.rulegov.catalog.FeatureCatalog;
import com.aegis.rulegov.service.repository.JdbcTransactionRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready when the feature catalog is loaded and the record store answers.
 */
@Readiness
@ApplicationScoped
public class GovernanceHealthCheck implements HealthCheck {

    @Inject
    FeatureCatalog catalog;

    @Inject
    JdbcTransactionRecordStore recordStore;

    @Override
    public HealthCheckResponse call() {
        try {
            long records = recordStore.count();
            return HealthCheckResponse.builder()
                    .name("rule-governance")
                    .up()
                    .withData("catalogVersion", catalog.version())
                    .withData("catalogFields", (long) catalog.features().size())
                    .withData("historicalRecords", records)
                    .build();
        } catch (RuntimeException e) {
            return HealthCheckResponse.builder()
                    .name("rule-governance")
                    .down()
                    .withData("reason", "Record store unavailable: " + e.getMessage())
                    .build();
        }
    }
}
