/* (C)2026 */
package com.ammann.conversion.properties;

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
     * Format catalogue endpoints
     */
    public static final class Formats {
        private Formats() {}

        public static final String BASE = "/formats";
    }

    /**
     * Conversion job endpoints
     */
    public static final class Conversions {
        private Conversions() {}

        public static final String BASE = "/conversions";
        public static final String JOB = "/{jobId}";
        public static final String RESULT = JOB + "/result";
    }

    /**
     * Lifecycle event stream endpoints
     */
    public static final class Events {
        private Events() {}

        public static final String BASE = "/events";
        public static final String SUBSCRIBERS = "/subscribers";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
    }
}
