package com.nodeforge.orchestrator;

import com.nodeforge.hooks.HookOutcome;
import com.nodeforge.plugin.PluginCategory;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one plugin in one category run (or cleanup). Created fresh per run; owned by the
 * caller once returned. Exactly one of {@link #getResult()} / {@link #getErrorMessage()} is
 * meaningful, depending on {@link #isSuccess()}.
 */
public final class ExecutionResult {

    private final String pluginName;
    private final String version;
    private final PluginCategory category;
    private final boolean success;
    private final Object result;
    private final String errorMessage;
    private final ErrorKind errorKind;
    private final String failedPhase;
    private final DurationMetrics durationMetrics;
    private final List<HookOutcome> hookOutcomes;

    private ExecutionResult(String pluginName, String version, PluginCategory category, boolean success,
                            Object result, String errorMessage, ErrorKind errorKind, String failedPhase,
                            DurationMetrics durationMetrics, List<HookOutcome> hookOutcomes) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.version = version;
        this.category = category;
        this.success = success;
        this.result = result;
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
        this.failedPhase = failedPhase;
        this.durationMetrics = durationMetrics != null ? durationMetrics : DurationMetrics.none();
        this.hookOutcomes = hookOutcomes != null ? List.copyOf(hookOutcomes) : List.of();
    }

    public static ExecutionResult success(String pluginName, String version, PluginCategory category, Object result,
                                          DurationMetrics metrics, List<HookOutcome> hookOutcomes) {
        return new ExecutionResult(pluginName, version, category, true, result, null, null, null, metrics, hookOutcomes);
    }

    public static ExecutionResult failure(String pluginName, String version, PluginCategory category,
                                          String errorMessage, ErrorKind errorKind, String failedPhase,
                                          DurationMetrics metrics, List<HookOutcome> hookOutcomes) {
        return new ExecutionResult(pluginName, version, category, false, null, errorMessage,
                Objects.requireNonNull(errorKind, "errorKind"), failedPhase, metrics, hookOutcomes);
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getVersion() {
        return version;
    }

    public PluginCategory getCategory() {
        return category;
    }

    public boolean isSuccess() {
        return success;
    }

    /** Body result of a successful run; null for failures and cleanup results. */
    public Object getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /** Null on success. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /** Phase that failed (lifecycle event value, {@code initialize}, {@code execute}, {@code teardown}); null otherwise. */
    public String getFailedPhase() {
        return failedPhase;
    }

    public DurationMetrics getDurationMetrics() {
        return durationMetrics;
    }

    public List<HookOutcome> getHookOutcomes() {
        return hookOutcomes;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" + category + "/" + pluginName + "@" + version + ", "
                + (success ? "success" : errorKind + ": " + errorMessage) + "}";
    }
}
