package com.chronicle.engine.config;

import com.chronicle.expression.ExpressionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * CHRONICLE_DEFAULT_BRANCH, CHRONICLE_MAX_EXPRESSION_DEPTH, CHRONICLE_INCLUDE_TRACE,
 * CHRONICLE_GRAPH_CACHE_ENABLED, CHRONICLE_REFUSE_CYCLIC_EFFECTS, CHRONICLE_SNAPSHOT_DIR.
 * Unset or blank variables take the defaults; unparseable values take the defaults with a warning.
 */
public final class RulesEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RulesEngineConfig.class);

    static final String ENV_DEFAULT_BRANCH = "CHRONICLE_DEFAULT_BRANCH";
    static final String ENV_MAX_EXPRESSION_DEPTH = "CHRONICLE_MAX_EXPRESSION_DEPTH";
    static final String ENV_INCLUDE_TRACE = "CHRONICLE_INCLUDE_TRACE";
    static final String ENV_GRAPH_CACHE_ENABLED = "CHRONICLE_GRAPH_CACHE_ENABLED";
    static final String ENV_REFUSE_CYCLIC_EFFECTS = "CHRONICLE_REFUSE_CYCLIC_EFFECTS";
    static final String ENV_SNAPSHOT_DIR = "CHRONICLE_SNAPSHOT_DIR";

    public static final String DEFAULT_BRANCH = "main";
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = ExpressionValidator.DEFAULT_MAX_DEPTH;
    public static final boolean DEFAULT_INCLUDE_TRACE = true;
    public static final boolean DEFAULT_GRAPH_CACHE_ENABLED = true;
    public static final boolean DEFAULT_REFUSE_CYCLIC_EFFECTS = false;
    public static final String DEFAULT_SNAPSHOT_DIR = "snapshots";

    private final String defaultBranch;
    private final int maxExpressionDepth;
    private final boolean includeTrace;
    private final boolean graphCacheEnabled;
    private final boolean refuseCyclicEffects;
    private final String snapshotDir;

    private RulesEngineConfig(Builder b) {
        this.defaultBranch = b.defaultBranch;
        this.maxExpressionDepth = b.maxExpressionDepth;
        this.includeTrace = b.includeTrace;
        this.graphCacheEnabled = b.graphCacheEnabled;
        this.refuseCyclicEffects = b.refuseCyclicEffects;
        this.snapshotDir = b.snapshotDir;
    }

    /** Branch used when a graph query passes a null or blank branch. Default {@code main}. */
    public String getDefaultBranch() {
        return defaultBranch;
    }

    /** Nesting limit for expression validation. Default 32. */
    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }

    public boolean isIncludeTrace() {
        return includeTrace;
    }

    public boolean isGraphCacheEnabled() {
        return graphCacheEnabled;
    }

    /** Whether effects on a cyclic write chain are recorded as failed instead of applied. Default false. */
    public boolean isRefuseCyclicEffects() {
        return refuseCyclicEffects;
    }

    /** Root directory of campaign snapshot files. Default {@code snapshots}. */
    public String getSnapshotDir() {
        return snapshotDir;
    }

    /** Branch to use for a query: the given one, or the default when null or blank. */
    public String branchOrDefault(String branchId) {
        return branchId != null && !branchId.isBlank() ? branchId.trim() : defaultBranch;
    }

    public static RulesEngineConfig defaults() {
        return builder().build();
    }

    public static RulesEngineConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Reads the CHRONICLE_* keys from the given map (environment-shaped). */
    public static RulesEngineConfig fromMap(Map<String, String> env) {
        Map<String, String> source = env != null ? env : Map.of();
        return builder()
                .defaultBranch(getEnv(source, ENV_DEFAULT_BRANCH, DEFAULT_BRANCH))
                .maxExpressionDepth(parseInt(source, ENV_MAX_EXPRESSION_DEPTH, DEFAULT_MAX_EXPRESSION_DEPTH))
                .includeTrace(parseBoolean(source, ENV_INCLUDE_TRACE, DEFAULT_INCLUDE_TRACE))
                .graphCacheEnabled(parseBoolean(source, ENV_GRAPH_CACHE_ENABLED, DEFAULT_GRAPH_CACHE_ENABLED))
                .refuseCyclicEffects(parseBoolean(source, ENV_REFUSE_CYCLIC_EFFECTS, DEFAULT_REFUSE_CYCLIC_EFFECTS))
                .snapshotDir(getEnv(source, ENV_SNAPSHOT_DIR, DEFAULT_SNAPSHOT_DIR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static boolean parseBoolean(Map<String, String> env, String key, boolean defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        log.warn("Invalid boolean for {}: '{}'; using default {}", key, value, defaultValue);
        return defaultValue;
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) return parsed;
            log.warn("Non-positive value for {}: '{}'; using default {}", key, value, defaultValue);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}'; using default {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    public static final class Builder {
        private String defaultBranch = DEFAULT_BRANCH;
        private int maxExpressionDepth = DEFAULT_MAX_EXPRESSION_DEPTH;
        private boolean includeTrace = DEFAULT_INCLUDE_TRACE;
        private boolean graphCacheEnabled = DEFAULT_GRAPH_CACHE_ENABLED;
        private boolean refuseCyclicEffects = DEFAULT_REFUSE_CYCLIC_EFFECTS;
        private String snapshotDir = DEFAULT_SNAPSHOT_DIR;

        public Builder defaultBranch(String defaultBranch) {
            this.defaultBranch = defaultBranch != null && !defaultBranch.isBlank() ? defaultBranch : DEFAULT_BRANCH;
            return this;
        }

        public Builder maxExpressionDepth(int maxExpressionDepth) {
            if (maxExpressionDepth <= 0) throw new IllegalArgumentException("maxExpressionDepth must be positive");
            this.maxExpressionDepth = maxExpressionDepth;
            return this;
        }

        public Builder includeTrace(boolean includeTrace) {
            this.includeTrace = includeTrace;
            return this;
        }

        public Builder graphCacheEnabled(boolean graphCacheEnabled) {
            this.graphCacheEnabled = graphCacheEnabled;
            return this;
        }

        public Builder refuseCyclicEffects(boolean refuseCyclicEffects) {
            this.refuseCyclicEffects = refuseCyclicEffects;
            return this;
        }

        public Builder snapshotDir(String snapshotDir) {
            this.snapshotDir = Objects.requireNonNullElse(snapshotDir, DEFAULT_SNAPSHOT_DIR);
            return this;
        }

        public RulesEngineConfig build() {
            return new RulesEngineConfig(this);
        }
    }
}
