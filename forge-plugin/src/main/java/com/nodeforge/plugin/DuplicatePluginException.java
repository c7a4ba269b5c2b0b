package com.nodeforge.plugin;

/** Thrown when a plugin name is already registered in the category. */
public final class DuplicatePluginException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final PluginCategory category;
    private final String pluginName;

    public DuplicatePluginException(PluginCategory category, String pluginName) {
        super(String.format("DuplicatePluginError: plugin '%s' is already registered in category %s", pluginName, category));
        this.category = category;
        this.pluginName = pluginName;
    }

    public PluginCategory getCategory() {
        return category;
    }

    public String getPluginName() {
        return pluginName;
    }
}
