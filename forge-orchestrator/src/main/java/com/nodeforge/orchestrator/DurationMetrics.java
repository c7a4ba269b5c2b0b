package com.nodeforge.orchestrator;

import java.time.Instant;

/** Timing of one plugin run: when it started, total wall time and the share spent in hooks. */
public final class DurationMetrics {

    private static final DurationMetrics NONE = new DurationMetrics(null, 0L, 0L);

    private final Instant startedAt;
    private final long durationMs;
    private final long hookDurationMs;

    public DurationMetrics(Instant startedAt, long durationMs, long hookDurationMs) {
        this.startedAt = startedAt;
        this.durationMs = durationMs;
        this.hookDurationMs = hookDurationMs;
    }

    /** Metrics of a plugin that never started (e.g. unmet dependencies). */
    public static DurationMetrics none() {
        return NONE;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getHookDurationMs() {
        return hookDurationMs;
    }
}
