package com.nodeforge.plugin.events;

import com.nodeforge.plugin.PluginCategory;

import java.time.Instant;
import java.util.Objects;

/** Immutable record of something that happened to a plugin. */
public final class PluginEvent {

    /** Phase of a {@code FAILED} event raised before the plugin ran, when a dependency is unmet. */
    public static final String PHASE_DEPENDENCY = "dependency";

    private final PluginEventType type;
    private final PluginCategory category;
    private final String pluginName;
    private final Instant timestamp;
    private final long durationMs;
    private final String phase;
    private final String errorMessage;

    private PluginEvent(PluginEventType type, PluginCategory category, String pluginName,
                        Instant timestamp, long durationMs, String phase, String errorMessage) {
        this.type = Objects.requireNonNull(type, "type");
        this.category = category;
        this.pluginName = pluginName;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.durationMs = durationMs;
        this.phase = phase;
        this.errorMessage = errorMessage;
    }

    public static PluginEvent of(PluginEventType type, PluginCategory category, String pluginName) {
        return new PluginEvent(type, category, pluginName, Instant.now(), -1L, null, null);
    }

    public static PluginEvent timed(PluginEventType type, PluginCategory category, String pluginName, long durationMs) {
        return new PluginEvent(type, category, pluginName, Instant.now(), durationMs, null, null);
    }

    /**
     * @param phase the phase that failed, e.g. {@code execute}, {@code teardown} or
     *              {@link #PHASE_DEPENDENCY}
     */
    public static PluginEvent failed(PluginCategory category, String pluginName, long durationMs, String phase,
                                     String errorMessage) {
        return new PluginEvent(PluginEventType.FAILED, category, pluginName, Instant.now(), durationMs, phase, errorMessage);
    }

    public PluginEventType getType() {
        return type;
    }

    public PluginCategory getCategory() {
        return category;
    }

    public String getPluginName() {
        return pluginName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** Duration of the phase that produced the event; -1 when not timed. */
    public long getDurationMs() {
        return durationMs;
    }

    /** The failed phase of a {@code FAILED} event; null for other events. */
    public String getPhase() {
        return phase;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "PluginEvent{" + type.toValue() + " " + category + "/" + pluginName
                + (phase != null ? ", phase=" + phase : "")
                + (errorMessage != null ? ", error=" + errorMessage : "") + "}";
    }
}
