package com.nodeforge.lifecycle;

import com.nodeforge.hooks.HookOutcome;

import java.time.Instant;

/** Running counters for one hook of one plugin. Snapshots are taken with {@link #copy()}. */
public final class HookStatistics {

    private long executionCount;
    private long successCount;
    private long failureCount;
    private long timeoutCount;
    private long skipCount;
    private long totalDurationMs;
    private Instant lastExecuted;

    synchronized void record(HookOutcome outcome) {
        switch (outcome.getStatus()) {
            case SKIPPED -> {
                skipCount++;
                return;
            }
            case SUCCESS -> successCount++;
            case FAILED -> failureCount++;
            case TIMED_OUT -> {
                failureCount++;
                timeoutCount++;
            }
        }
        executionCount++;
        totalDurationMs += outcome.getDurationMs();
        lastExecuted = Instant.now();
    }

    synchronized HookStatistics copy() {
        HookStatistics c = new HookStatistics();
        c.executionCount = executionCount;
        c.successCount = successCount;
        c.failureCount = failureCount;
        c.timeoutCount = timeoutCount;
        c.skipCount = skipCount;
        c.totalDurationMs = totalDurationMs;
        c.lastExecuted = lastExecuted;
        return c;
    }

    /** Invocations of the handler (skips excluded). */
    public synchronized long getExecutionCount() {
        return executionCount;
    }

    public synchronized long getSuccessCount() {
        return successCount;
    }

    /** Failures including timeouts. */
    public synchronized long getFailureCount() {
        return failureCount;
    }

    public synchronized long getTimeoutCount() {
        return timeoutCount;
    }

    public synchronized long getSkipCount() {
        return skipCount;
    }

    public synchronized double getAverageDurationMs() {
        return executionCount == 0 ? 0.0 : (double) totalDurationMs / executionCount;
    }

    public synchronized Instant getLastExecuted() {
        return lastExecuted;
    }
}
