package com.nodeforge.hooks;

import com.nodeforge.annotations.LifecycleEvent;

import java.util.List;

/**
 * Thrown by the scheduler when a critical hook fails or times out. The remaining hooks of the
 * event did not run. {@link #getOutcomes()} holds the outcomes recorded up to and including the
 * failing hook; the cause is the hook's own error.
 */
public final class CriticalHookException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String hookName;
    private final LifecycleEvent event;
    private final transient List<HookOutcome> outcomes;

    public CriticalHookException(String hookName, LifecycleEvent event, List<HookOutcome> outcomes, Throwable cause) {
        super(String.format("Critical hook '%s' failed on %s: %s", hookName, event,
                cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause)), cause);
        this.hookName = hookName;
        this.event = event;
        this.outcomes = List.copyOf(outcomes);
    }

    public String getHookName() {
        return hookName;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public List<HookOutcome> getOutcomes() {
        return outcomes;
    }
}
