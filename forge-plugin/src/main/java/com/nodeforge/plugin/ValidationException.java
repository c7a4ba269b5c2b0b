package com.nodeforge.plugin;

import java.util.List;

/** Thrown when a plugin descriptor fails structural validation. Carries every problem found. */
public final class ValidationException extends PluginException {

    private static final long serialVersionUID = 1L;

    private final String pluginName;
    private final List<String> errors;

    public ValidationException(String pluginName, List<String> errors) {
        super(String.format("ValidationError: plugin '%s' is invalid: %s", pluginName, String.join("; ", errors)));
        this.pluginName = pluginName;
        this.errors = List.copyOf(errors);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getErrors() {
        return errors;
    }
}
