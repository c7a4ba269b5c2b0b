package com.nodeforge.lifecycle;

import com.nodeforge.executioncontext.PluginStateStore;
import com.nodeforge.hooks.HookOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime state owned by one plugin's lifecycle: current {@link PluginState}, execution counters,
 * per-hook statistics and the key-value store plugins use between phases.
 */
public final class PluginRuntimeState implements PluginStateStore {

    private volatile PluginState state = PluginState.UNREGISTERED;

    private final Map<String, Object> store = new ConcurrentHashMap<>();
    private final Map<String, HookStatistics> hookStats = new ConcurrentHashMap<>();

    private long executionCount;
    private long successCount;
    private long failureCount;
    private long errorCount;
    private long totalExecutionMs;
    private Instant lastExecution;

    public PluginState getState() {
        return state;
    }

    void setState(PluginState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    synchronized void recordExecutionStart(Instant at) {
        executionCount++;
        lastExecution = at;
    }

    synchronized void recordExecutionEnd(boolean success, long durationMs) {
        if (success) {
            successCount++;
        } else {
            failureCount++;
        }
        totalExecutionMs += durationMs;
    }

    synchronized void recordPhaseError() {
        errorCount++;
    }

    void recordHooks(List<HookOutcome> outcomes) {
        for (HookOutcome o : outcomes) {
            hookStats.computeIfAbsent(o.getHookName(), k -> new HookStatistics()).record(o);
        }
    }

    public synchronized PluginMetrics getMetrics() {
        long finished = successCount + failureCount;
        return new PluginMetrics(executionCount, successCount, failureCount, errorCount, lastExecution,
                finished == 0 ? 0.0 : (double) totalExecutionMs / finished);
    }

    /** Snapshot of hook statistics keyed by hook name, sorted by name. */
    public Map<String, HookStatistics> getHookStatistics() {
        Map<String, HookStatistics> out = new LinkedHashMap<>();
        for (String name : new TreeSet<>(hookStats.keySet())) {
            out.put(name, hookStats.get(name).copy());
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public Object get(String key) {
        return key != null ? store.get(key) : null;
    }

    @Override
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            store.remove(key);
        } else {
            store.put(key, value);
        }
    }

    @Override
    public Object remove(String key) {
        return key != null ? store.remove(key) : null;
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(store.keySet()));
    }
}
