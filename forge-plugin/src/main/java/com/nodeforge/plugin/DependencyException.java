package com.nodeforge.plugin;

import java.util.List;

/**
 * A plugin's declared dependencies cannot be met: no admitted plugin of the required name, a
 * version below the requirement, or a dependency that itself could not run. Captured into the
 * plugin's result rather than thrown out of a category run.
 */
public final class DependencyException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final String pluginName;
    private final List<String> unmet;

    public DependencyException(String pluginName, List<String> unmet) {
        super(String.format("DependencyError: plugin '%s' has unmet dependencies: %s", pluginName, String.join(", ", unmet)));
        this.pluginName = pluginName;
        this.unmet = List.copyOf(unmet);
    }

    public String getPluginName() {
        return pluginName;
    }

    /** One human-readable entry per unmet dependency, e.g. {@code api-core@>=1.0.0 (missing)}. */
    public List<String> getUnmet() {
        return unmet;
    }
}
