package com.nodeforge.executioncontext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable free-form context handed to plugin bodies and hooks. Callers supply at least
 * {@value #PROJECT_PATH} and {@value #ACTION}; every other attribute is opaque to the engine.
 * <p>
 * The lifecycle binds the running plugin's name and {@link PluginStateStore} with
 * {@link #forPlugin(String, PluginStateStore)}; {@link #with(String, Object)} returns a copy with one
 * more attribute (used to add {@value #ERROR} and {@value #FAILED_PHASE} for error hooks).
 */
public final class PluginContext {

    public static final String PROJECT_PATH = "projectPath";
    public static final String ACTION = "action";
    /** Set on the context given to error hooks: the {@link Throwable} that failed the phase. */
    public static final String ERROR = "error";
    /** Set on the context given to error hooks: the phase that failed (event value or {@code execute}). */
    public static final String FAILED_PHASE = "failedPhase";

    private static final PluginContext EMPTY = new PluginContext(Map.of(), null, null);

    private final Map<String, Object> attributes;
    private final String pluginName;
    private final PluginStateStore store;

    private PluginContext(Map<String, Object> attributes, String pluginName, PluginStateStore store) {
        this.attributes = attributes;
        this.pluginName = pluginName;
        this.store = store;
    }

    public static PluginContext empty() {
        return EMPTY;
    }

    /** Creates a context from a copy of the given attributes. Null values are kept. */
    public static PluginContext of(Map<String, ?> attributes) {
        return new PluginContext(copy(attributes), null, null);
    }

    /** Convenience for the two attributes every caller supplies. */
    public static PluginContext of(String projectPath, String action) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(PROJECT_PATH, projectPath);
        m.put(ACTION, action);
        return new PluginContext(Collections.unmodifiableMap(m), null, null);
    }

    public String getProjectPath() {
        return getString(PROJECT_PATH);
    }

    public String getAction() {
        return getString(ACTION);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * Returns the attribute cast to the given type, or null when absent or of another type.
     */
    public <T> T get(String key, Class<T> type) {
        Object v = attributes.get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    public String getString(String key) {
        Object v = attributes.get(key);
        return v != null ? v.toString() : null;
    }

    public boolean containsKey(String key) {
        return attributes.containsKey(key);
    }

    /** Unmodifiable view of all attributes. */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /** Name of the plugin this context is bound to, or null for a caller-built context. */
    public String getPluginName() {
        return pluginName;
    }

    /** State store of the bound plugin, or null for a caller-built context. */
    public PluginStateStore getStore() {
        return store;
    }

    /** Returns a copy with the attribute set (replacing any previous value). */
    public PluginContext with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> m = new LinkedHashMap<>(attributes);
        m.put(key, value);
        return new PluginContext(Collections.unmodifiableMap(m), pluginName, store);
    }

    /** Returns a copy bound to the given plugin and its state store. */
    public PluginContext forPlugin(String pluginName, PluginStateStore store) {
        return new PluginContext(attributes, Objects.requireNonNull(pluginName, "pluginName"),
                Objects.requireNonNull(store, "store"));
    }

    private static Map<String, Object> copy(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public String toString() {
        return "PluginContext{plugin=" + pluginName + ", attributes=" + attributes.keySet() + "}";
    }
}
