package com.nodeforge.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * Hooks: FORGE_DEFAULT_HOOK_TIMEOUT_MS (0 = no timeout), FORGE_HOOK_THREADS. Analysis: FORGE_EXECUTION_TYPE (SYNC or ASYNC).
 * Events: FORGE_EVENT_HISTORY_SIZE, FORGE_METRICS_ENABLED. Discovery: FORGE_PLUGINS_DIR.
 */
public final class ForgeConfig {

    private static final String ENV_DEFAULT_HOOK_TIMEOUT_MS = "FORGE_DEFAULT_HOOK_TIMEOUT_MS";
    private static final String ENV_HOOK_THREADS = "FORGE_HOOK_THREADS";
    private static final String ENV_EXECUTION_TYPE = "FORGE_EXECUTION_TYPE";
    private static final String ENV_EVENT_HISTORY_SIZE = "FORGE_EVENT_HISTORY_SIZE";
    private static final String ENV_METRICS_ENABLED = "FORGE_METRICS_ENABLED";
    private static final String ENV_PLUGINS_DIR = "FORGE_PLUGINS_DIR";

    private static final long DEFAULT_HOOK_TIMEOUT_MS = 0L;
    private static final int DEFAULT_HOOK_THREADS = 4;
    private static final int DEFAULT_EVENT_HISTORY_SIZE = 100;

    private final long defaultHookTimeoutMillis;
    private final int hookThreads;
    private final ExecutionType executionType;
    private final int eventHistorySize;
    private final boolean metricsEnabled;
    private final Path pluginsDir;

    private ForgeConfig(Builder b) {
        this.defaultHookTimeoutMillis = Math.max(0L, b.defaultHookTimeoutMillis);
        this.hookThreads = Math.max(1, b.hookThreads);
        this.executionType = b.executionType != null ? b.executionType : ExecutionType.SYNC;
        this.eventHistorySize = Math.max(0, b.eventHistorySize);
        this.metricsEnabled = b.metricsEnabled;
        this.pluginsDir = b.pluginsDir;
    }

    /** Timeout applied to hooks that declare none; 0 means hooks without a timeout run inline. */
    public long getDefaultHookTimeoutMillis() {
        return defaultHookTimeoutMillis;
    }

    /** Threads of the pool that runs timed hooks. Default 4. */
    public int getHookThreads() {
        return hookThreads;
    }

    public ExecutionType getExecutionType() {
        return executionType;
    }

    /** Number of plugin events kept in the event history. Default 100; 0 disables history. */
    public int getEventHistorySize() {
        return eventHistorySize;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /** Directory scanned for community plugin JARs, or null when no directory is configured. */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    public static ForgeConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds configuration from a variable map using the same names and defaults as
     * {@link #fromEnvironment()}. Unparseable numbers fall back to their defaults.
     */
    public static ForgeConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String pluginsDir = get(env, ENV_PLUGINS_DIR, null);
        return builder()
                .defaultHookTimeoutMillis(parseLong(env.get(ENV_DEFAULT_HOOK_TIMEOUT_MS), DEFAULT_HOOK_TIMEOUT_MS))
                .hookThreads(parseInt(env.get(ENV_HOOK_THREADS), DEFAULT_HOOK_THREADS))
                .executionType(ExecutionType.fromValue(env.get(ENV_EXECUTION_TYPE)))
                .eventHistorySize(parseInt(env.get(ENV_EVENT_HISTORY_SIZE), DEFAULT_EVENT_HISTORY_SIZE))
                .metricsEnabled(parseBoolean(env.get(ENV_METRICS_ENABLED), true))
                .pluginsDir(pluginsDir != null ? Path.of(pluginsDir) : null)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private long defaultHookTimeoutMillis = DEFAULT_HOOK_TIMEOUT_MS;
        private int hookThreads = DEFAULT_HOOK_THREADS;
        private ExecutionType executionType = ExecutionType.SYNC;
        private int eventHistorySize = DEFAULT_EVENT_HISTORY_SIZE;
        private boolean metricsEnabled = true;
        private Path pluginsDir;

        public Builder defaultHookTimeoutMillis(long defaultHookTimeoutMillis) {
            this.defaultHookTimeoutMillis = defaultHookTimeoutMillis;
            return this;
        }

        public Builder hookThreads(int hookThreads) {
            this.hookThreads = hookThreads;
            return this;
        }

        public Builder executionType(ExecutionType executionType) {
            this.executionType = executionType;
            return this;
        }

        public Builder eventHistorySize(int eventHistorySize) {
            this.eventHistorySize = eventHistorySize;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public ForgeConfig build() {
            return new ForgeConfig(this);
        }
    }
}
