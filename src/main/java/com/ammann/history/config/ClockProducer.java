/* (C)2026 */
package com.ammann.history.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Produces the process clock. Its zone is the process-local zone used for naive
 * datetimes and local timestamp conversion.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemDefaultZone();
    }
}
