package com.nodeforge.lifecycle;

import java.time.Instant;

/**
 * Immutable snapshot of a plugin's execution metrics. Execution counters cover
 * {@code execute} attempts; {@link #getErrorCount()} counts failed phases of any kind.
 */
public final class PluginMetrics {

    private final long executionCount;
    private final long successCount;
    private final long failureCount;
    private final long errorCount;
    private final Instant lastExecution;
    private final double averageExecutionMs;

    PluginMetrics(long executionCount, long successCount, long failureCount, long errorCount,
                  Instant lastExecution, double averageExecutionMs) {
        this.executionCount = executionCount;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.errorCount = errorCount;
        this.lastExecution = lastExecution;
        this.averageExecutionMs = averageExecutionMs;
    }

    public long getExecutionCount() {
        return executionCount;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    /** Start of the last execute attempt, or null if the plugin never ran. */
    public Instant getLastExecution() {
        return lastExecution;
    }

    public double getAverageExecutionMs() {
        return averageExecutionMs;
    }

    @Override
    public String toString() {
        return "PluginMetrics{executions=" + executionCount + ", successes=" + successCount
                + ", failures=" + failureCount + ", errors=" + errorCount + "}";
    }
}
