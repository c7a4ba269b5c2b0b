package com.nodeforge.plugin;

/** Thrown when an operation names a plugin that is not registered in the category. */
public final class PluginNotFoundException extends PluginException {

    private static final long serialVersionUID = 1L;

    public PluginNotFoundException(PluginCategory category, String pluginName) {
        super(String.format("Plugin '%s' is not registered in category %s", pluginName, category));
    }
}
