package com.nodeforge.executioncontext;

import java.util.Set;

/**
 * Per-plugin key-value store kept for the lifetime of the plugin inside one engine process.
 * Plugins use it to hand data from one phase to the next (e.g. a connection check done in a
 * pre-execute hook, read by the body).
 */
public interface PluginStateStore {

    /** Returns the value for the key, or null if absent. */
    Object get(String key);

    /** Stores a value; a null value removes the key. */
    void put(String key, Object value);

    /** Removes the key and returns the previous value, or null. */
    Object remove(String key);

    /** Snapshot of the stored keys. */
    Set<String> keys();
}
