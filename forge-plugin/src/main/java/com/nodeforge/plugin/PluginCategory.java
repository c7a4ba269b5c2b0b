package com.nodeforge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Fixed set of plugin categories. Each category is orchestrated independently. */
public enum PluginCategory {
    ENVIRONMENT("environment"),
    API("api"),
    MICROSERVICES("microservices"),
    PERFORMANCE("performance"),
    SECURITY("security"),
    DATABASE("database");

    private final String value;

    PluginCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * Parses a category name, case-insensitively.
     *
     * @throws CategoryException if the name is not a known category
     */
    @JsonCreator
    public static PluginCategory fromValue(String value) {
        PluginCategory c = find(value);
        if (c == null) {
            throw new CategoryException(value);
        }
        return c;
    }

    /** Returns the category for the name, or null when unknown. */
    public static PluginCategory find(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        for (PluginCategory c : values()) {
            if (c.value.equalsIgnoreCase(v)) return c;
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
