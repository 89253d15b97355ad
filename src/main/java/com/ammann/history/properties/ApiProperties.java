/* (C)2026 */
package com.ammann.history.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>The history endpoints follow the Signal K history API layout; administrative
 * endpoints live under the versioned application base path.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Signal K history endpoints
     */
    public static final class History {
        private History() {}

        public static final String BASE = "/signalk/v1/history";
        public static final String VALUES = "/values";
        public static final String CONTEXTS = "/contexts";
        public static final String PATHS = "/paths";
    }

    /**
     * Administrative endpoints
     */
    public static final class Admin {
        private Admin() {}

        public static final String BASE = "/admin";
        public static final String CACHE = BASE + "/cache";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
