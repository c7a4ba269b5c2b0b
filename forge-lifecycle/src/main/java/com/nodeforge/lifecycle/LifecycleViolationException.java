package com.nodeforge.lifecycle;

import com.nodeforge.plugin.PluginException;

/** Thrown when a phase is requested from a state that does not allow it (e.g. execute after cleanup). */
public final class LifecycleViolationException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final String pluginName;
    private final PluginState state;

    public LifecycleViolationException(String pluginName, PluginState state, String operation) {
        super(String.format("LifecycleError: cannot %s plugin '%s' in state %s", operation, pluginName, state));
        this.pluginName = pluginName;
        this.state = state;
    }

    public String getPluginName() {
        return pluginName;
    }

    public PluginState getState() {
        return state;
    }
}
