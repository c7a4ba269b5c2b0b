package com.nodeforge.hooks;

import com.nodeforge.annotations.LifecycleEvent;

import java.util.Objects;

/** Recorded result of one hook invocation within a phase. */
public final class HookOutcome {

    private final String hookName;
    private final LifecycleEvent event;
    private final HookStatus status;
    private final Object result;
    private final Throwable error;
    private final long durationMs;

    private HookOutcome(String hookName, LifecycleEvent event, HookStatus status,
                        Object result, Throwable error, long durationMs) {
        this.hookName = Objects.requireNonNull(hookName, "hookName");
        this.event = Objects.requireNonNull(event, "event");
        this.status = Objects.requireNonNull(status, "status");
        this.result = result;
        this.error = error;
        this.durationMs = durationMs;
    }

    public static HookOutcome success(String hookName, LifecycleEvent event, Object result, long durationMs) {
        return new HookOutcome(hookName, event, HookStatus.SUCCESS, result, null, durationMs);
    }

    public static HookOutcome failed(String hookName, LifecycleEvent event, Throwable error, long durationMs) {
        return new HookOutcome(hookName, event, HookStatus.FAILED, null, error, durationMs);
    }

    public static HookOutcome timedOut(String hookName, LifecycleEvent event, HookTimeoutException error) {
        return new HookOutcome(hookName, event, HookStatus.TIMED_OUT, null, error, error.getTimeout().toMillis());
    }

    public static HookOutcome skipped(String hookName, LifecycleEvent event) {
        return new HookOutcome(hookName, event, HookStatus.SKIPPED, null, null, 0L);
    }

    public String getHookName() {
        return hookName;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public HookStatus getStatus() {
        return status;
    }

    public Object getResult() {
        return result;
    }

    public Throwable getError() {
        return error;
    }

    public String getErrorMessage() {
        if (error == null) return null;
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public long getDurationMs() {
        return durationMs;
    }

    /** True for FAILED and TIMED_OUT. */
    public boolean isFailure() {
        return status == HookStatus.FAILED || status == HookStatus.TIMED_OUT;
    }

    @Override
    public String toString() {
        return "HookOutcome{" + event + ":" + hookName + "=" + status + ", " + durationMs + "ms}";
    }
}
