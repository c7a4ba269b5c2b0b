package com.nodeforge.plugin.events;

/**
 * Observer of plugin events. Listeners cannot affect a run: an exception thrown here is logged
 * by the bus and the next listener is still called.
 */
@FunctionalInterface
public interface PluginEventListener {

    void onEvent(PluginEvent event);
}
