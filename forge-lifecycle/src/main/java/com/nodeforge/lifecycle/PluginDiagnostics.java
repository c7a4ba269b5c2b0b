package com.nodeforge.lifecycle;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.plugin.PluginCategory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of one plugin for debugging: identity, state, metrics, resolved hook order
 * per event, hook statistics and the keys held in its state store.
 */
public final class PluginDiagnostics {

    private final String name;
    private final String version;
    private final PluginCategory category;
    private final PluginState state;
    private final PluginMetrics metrics;
    private final Map<LifecycleEvent, List<String>> hookOrder;
    private final Map<String, HookStatistics> hookStatistics;
    private final Set<String> stateKeys;

    PluginDiagnostics(String name, String version, PluginCategory category, PluginState state, PluginMetrics metrics,
                      Map<LifecycleEvent, List<String>> hookOrder, Map<String, HookStatistics> hookStatistics,
                      Set<String> stateKeys) {
        this.name = name;
        this.version = version;
        this.category = category;
        this.state = state;
        this.metrics = metrics;
        this.hookOrder = Map.copyOf(hookOrder);
        this.hookStatistics = hookStatistics;
        this.stateKeys = stateKeys;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public PluginCategory getCategory() {
        return category;
    }

    public PluginState getState() {
        return state;
    }

    public PluginMetrics getMetrics() {
        return metrics;
    }

    /** Resolved hook names per event, built-ins included; events without hooks are absent. */
    public Map<LifecycleEvent, List<String>> getHookOrder() {
        return hookOrder;
    }

    public Map<String, HookStatistics> getHookStatistics() {
        return hookStatistics;
    }

    public Set<String> getStateKeys() {
        return stateKeys;
    }
}
