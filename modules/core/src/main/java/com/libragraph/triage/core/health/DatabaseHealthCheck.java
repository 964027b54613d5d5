package com.libragraph.triage.core.health;

import com.libragraph.triage.core.db.DatabaseService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (!databaseService.ping()) {
            return HealthCheckResponse.named("database").down().build();
        }
        return HealthCheckResponse.named("database")
                .up()
                .withData("version", String.valueOf(databaseService.productVersion()))
                .build();
    }
}
