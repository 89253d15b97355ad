package com.ammann.history.health;

import com.ammann.history.store.DuckDbConnectionProvider;
import com.ammann.history.store.StoreLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that verifies the query engine answers and the data directory is
 * readable.
 *
 * <p>Exposes the data directory and the engine round-trip time as health check data.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements HealthCheck {

    @Inject DuckDbConnectionProvider connectionProvider;

    @Inject StoreLayout storeLayout;

    @Override
    public HealthCheckResponse call() {
        Path root = storeLayout.root();
        try {
            Instant start = Instant.now();
            boolean engineUp = connectionProvider.isAvailable();
            Duration queryTime = Duration.between(start, Instant.now());
            boolean dataDirectoryReadable = Files.isDirectory(root) && Files.isReadable(root);

            return HealthCheckResponse.named("store-health")
                    .status(engineUp && dataDirectoryReadable)
                    .withData("data-dir", root.toString())
                    .withData("data-dir-readable", dataDirectoryReadable)
                    .withData("engine-query-time-ms", queryTime.toMillis())
                    .withData("engine", "DuckDB")
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("store-health")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("data-dir", root.toString())
                    .build();
        }
    }
}
