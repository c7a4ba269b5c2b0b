package com.nodeforge.hooks;

import com.nodeforge.annotations.LifecycleEvent;

import java.time.Duration;

/** Recorded when a hook handler does not finish within its timeout. */
public final class HookTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String hookName;
    private final LifecycleEvent event;
    private final Duration timeout;

    public HookTimeoutException(String hookName, LifecycleEvent event, Duration timeout) {
        super(String.format("TimeoutError: hook '%s' on %s did not finish within %d ms",
                hookName, event, timeout.toMillis()));
        this.hookName = hookName;
        this.event = event;
        this.timeout = timeout;
    }

    public String getHookName() {
        return hookName;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
