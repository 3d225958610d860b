package com.pathwise.config;

import java.util.Objects;

/**
 * Configuration loaded from environment variables for the workflow engine.
 * <p>
 * Plan library: PATHWISE_PLAN_LIBRARY_DIR, PATHWISE_PLAN_LIBRARY_FILE.
 * Engine limits: PATHWISE_MAX_ROUTE_DEPTH, PATHWISE_EVENT_LOG_CAPACITY.
 * Escalation: PATHWISE_DEFAULT_PACE_LEVEL (used when an escalate node declares none).
 */
public final class PathwiseConfig {

    private static final String ENV_PLAN_LIBRARY_DIR = "PATHWISE_PLAN_LIBRARY_DIR";
    private static final String ENV_PLAN_LIBRARY_FILE = "PATHWISE_PLAN_LIBRARY_FILE";
    private static final String ENV_MAX_ROUTE_DEPTH = "PATHWISE_MAX_ROUTE_DEPTH";
    private static final String ENV_EVENT_LOG_CAPACITY = "PATHWISE_EVENT_LOG_CAPACITY";
    private static final String ENV_DEFAULT_PACE_LEVEL = "PATHWISE_DEFAULT_PACE_LEVEL";

    public static final String DEFAULT_PLAN_LIBRARY_DIR = "config";
    public static final String DEFAULT_PLAN_LIBRARY_FILE = "plan_library.json";
    public static final int DEFAULT_MAX_ROUTE_DEPTH = 15;
    public static final int DEFAULT_EVENT_LOG_CAPACITY = 50;
    public static final String DEFAULT_PACE_LEVEL = "contingent";

    private final String planLibraryDir;
    private final String planLibraryFile;
    private final int maxRouteDepth;
    private final int eventLogCapacity;
    private final String defaultPaceLevel;

    private PathwiseConfig(Builder b) {
        this.planLibraryDir = b.planLibraryDir;
        this.planLibraryFile = b.planLibraryFile;
        this.maxRouteDepth = b.maxRouteDepth;
        this.eventLogCapacity = b.eventLogCapacity;
        this.defaultPaceLevel = b.defaultPaceLevel;
    }

    /** Directory holding the plan library file. Default {@code config}. */
    public String getPlanLibraryDir() {
        return planLibraryDir;
    }

    /** Plan library file name inside {@link #getPlanLibraryDir()}. Default {@code plan_library.json}. */
    public String getPlanLibraryFile() {
        return planLibraryFile;
    }

    /** Max hops auto-routing may take in one turn. Default 15. */
    public int getMaxRouteDepth() {
        return maxRouteDepth;
    }

    /** Events kept per traversal; oldest are evicted first. Default 50. */
    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    /** Pace level applied when an escalate node does not declare one. Default {@code contingent}. */
    public String getDefaultPaceLevel() {
        return defaultPaceLevel;
    }

    public static PathwiseConfig fromEnvironment() {
        return builder()
                .planLibraryDir(getEnv(ENV_PLAN_LIBRARY_DIR, DEFAULT_PLAN_LIBRARY_DIR))
                .planLibraryFile(getEnv(ENV_PLAN_LIBRARY_FILE, DEFAULT_PLAN_LIBRARY_FILE))
                .maxRouteDepth(parseInt(System.getenv(ENV_MAX_ROUTE_DEPTH), DEFAULT_MAX_ROUTE_DEPTH))
                .eventLogCapacity(parseInt(System.getenv(ENV_EVENT_LOG_CAPACITY), DEFAULT_EVENT_LOG_CAPACITY))
                .defaultPaceLevel(getEnv(ENV_DEFAULT_PACE_LEVEL, DEFAULT_PACE_LEVEL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String planLibraryDir = DEFAULT_PLAN_LIBRARY_DIR;
        private String planLibraryFile = DEFAULT_PLAN_LIBRARY_FILE;
        private int maxRouteDepth = DEFAULT_MAX_ROUTE_DEPTH;
        private int eventLogCapacity = DEFAULT_EVENT_LOG_CAPACITY;
        private String defaultPaceLevel = DEFAULT_PACE_LEVEL;

        public Builder planLibraryDir(String planLibraryDir) {
            this.planLibraryDir = planLibraryDir != null ? planLibraryDir : DEFAULT_PLAN_LIBRARY_DIR;
            return this;
        }

        public Builder planLibraryFile(String planLibraryFile) {
            this.planLibraryFile = planLibraryFile != null ? planLibraryFile : DEFAULT_PLAN_LIBRARY_FILE;
            return this;
        }

        public Builder maxRouteDepth(int maxRouteDepth) {
            this.maxRouteDepth = maxRouteDepth;
            return this;
        }

        public Builder eventLogCapacity(int eventLogCapacity) {
            this.eventLogCapacity = eventLogCapacity;
            return this;
        }

        public Builder defaultPaceLevel(String defaultPaceLevel) {
            this.defaultPaceLevel = Objects.requireNonNullElse(defaultPaceLevel, DEFAULT_PACE_LEVEL);
            return this;
        }

        public PathwiseConfig build() {
            return new PathwiseConfig(this);
        }
    }
}
