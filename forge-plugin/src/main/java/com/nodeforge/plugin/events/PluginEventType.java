package com.nodeforge.plugin.events;

import com.fasterxml.jackson.annotation.JsonValue;

/** Plugin events published on the event bus. */
public enum PluginEventType {
    REGISTERED("plugin:registered"),
    UNREGISTERED("plugin:unregistered"),
    INITIALIZED("plugin:initialized"),
    EXECUTED("plugin:executed"),
    FAILED("plugin:error"),
    CLEANED_UP("plugin:cleaned-up");

    private final String value;

    PluginEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
