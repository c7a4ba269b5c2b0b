package com.nodeforge.hooks;

/**
 * Wraps a failure of the scheduling machinery itself around a hook (e.g. the calling thread was
 * interrupted while waiting for a timed hook). Handler exceptions are recorded as they are thrown.
 */
public final class HookExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String hookName;

    public HookExecutionException(String hookName, String message, Throwable cause) {
        super(message, cause);
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}
