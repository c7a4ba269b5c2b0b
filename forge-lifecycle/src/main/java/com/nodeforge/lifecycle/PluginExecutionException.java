package com.nodeforge.lifecycle;

import com.nodeforge.plugin.PluginException;

/**
 * Raised by the lifecycle when a phase fails. The cause is the original failure (handler or body
 * exception, {@link com.nodeforge.hooks.CriticalHookException}, ...); {@link #getFailedPhase()}
 * names where it happened: a lifecycle event value, {@code initialize}, {@code execute} or
 * {@code teardown}.
 */
public final class PluginExecutionException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final String pluginName;
    private final String failedPhase;

    public PluginExecutionException(String pluginName, String failedPhase, Throwable cause) {
        super(String.format("ExecutionError: plugin '%s' failed in %s: %s", pluginName, failedPhase, describe(cause)), cause);
        this.pluginName = pluginName;
        this.failedPhase = failedPhase;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getFailedPhase() {
        return failedPhase;
    }
}
