package com.nodeforge.annotations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of lifecycle events a hook can attach to. Wire names are lowercase with hyphens
 * (e.g. {@code pre-init}); {@link #fromValue(String)} also accepts the enum constant name.
 */
public enum LifecycleEvent {
    /** Before the plugin's own initialization logic. */
    PRE_INIT("pre-init"),
    /** After the plugin's own initialization logic succeeded. */
    POST_INIT("post-init"),
    /** Before the plugin body runs. */
    PRE_EXECUTE("pre-execute"),
    /** After the plugin body returned. */
    POST_EXECUTE("post-execute"),
    /** Dispatched once when a phase fails. Never re-entered from its own hooks. */
    ERROR("error"),
    /** Before plugin teardown. */
    CLEANUP("cleanup");

    private final String value;

    LifecycleEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * Parses a wire name or constant name.
     *
     * @throws IllegalArgumentException if the value is blank or names no event
     */
    @JsonCreator
    public static LifecycleEvent fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Lifecycle event must be non-blank");
        }
        String v = value.trim();
        for (LifecycleEvent e : values()) {
            if (e.value.equalsIgnoreCase(v) || e.name().equalsIgnoreCase(v)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle event: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
