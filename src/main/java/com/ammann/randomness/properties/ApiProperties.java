/* (C)2026 */
package com.ammann.randomness.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Randomness analysis endpoints
     */
    public static final class Analysis {
        private Analysis() {}

        public static final String BASE = "/analysis";
        public static final String REPORT = BASE + "/report";
        public static final String FILE = BASE + "/file";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String READY = BASE + "/ready";
    }
}
