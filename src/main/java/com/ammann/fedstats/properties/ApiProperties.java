/* (C)2026 */
package com.ammann.fedstats.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Run and round endpoints
     */
    public static final class Runs {
        private Runs() {}

        public static final String BASE = "/runs";
        public static final String RUN = "/{runId}";
        public static final String ROUND = RUN + "/rounds/{sequence}/{round}";
        public static final String PARTICIPANT = ROUND + "/participants/{participant}";
        public static final String AGGREGATE = ROUND + "/aggregate";
        public static final String CLOSE = ROUND + "/close";
        public static final String GLOBAL = ROUND + "/global";
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
    }
}
