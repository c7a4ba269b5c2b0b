package com.nodeforge.lifecycle;

/**
 * Lifecycle states of one plugin. {@link #EXECUTING} is also the resting state after a
 * successful run; {@link #CLEANED_UP} is terminal.
 */
public enum PluginState {
    UNREGISTERED,
    REGISTERED,
    INITIALIZED,
    EXECUTING,
    ERROR,
    CLEANED_UP
}
