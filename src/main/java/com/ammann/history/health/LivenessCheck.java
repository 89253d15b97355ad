package com.ammann.history.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that reports the history service as alive whenever it can
 * answer.
 *
 * <p>Store availability is covered by {@link StoreHealthCheck}; a slow or missing data
 * directory must not get the process restarted.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.up("history-processor-alive");
    }

}
