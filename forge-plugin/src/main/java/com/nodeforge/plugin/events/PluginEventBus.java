package com.nodeforge.plugin.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous publisher of {@link PluginEvent}s with a bounded history. Listeners are observers:
 * failures are logged and skipped, never propagated to the phase that published the event.
 */
public final class PluginEventBus {

    private static final Logger log = LoggerFactory.getLogger(PluginEventBus.class);

    /** History size used by {@link #PluginEventBus()}. */
    public static final int DEFAULT_HISTORY_SIZE = 100;

    private final List<PluginEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<PluginEvent> history = new ArrayDeque<>();
    private final int maxHistory;

    public PluginEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    /** @param maxHistory events kept in history; 0 keeps none */
    public PluginEventBus(int maxHistory) {
        this.maxHistory = Math.max(0, maxHistory);
    }

    public void subscribe(PluginEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean unsubscribe(PluginEventListener listener) {
        return listeners.remove(listener);
    }

    public void publish(PluginEvent event) {
        Objects.requireNonNull(event, "event");
        record(event);
        for (PluginEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Plugin event listener {} failed on {} (observer; continuing): {}",
                        listener.getClass().getName(), event.getType().toValue(), e.getMessage(), e);
            }
        }
    }

    private void record(PluginEvent event) {
        if (maxHistory == 0) return;
        synchronized (history) {
            history.addLast(event);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
    }

    /** Oldest-first copy of the history. */
    public List<PluginEvent> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /** Oldest-first copy of the history restricted to one event type. */
    public List<PluginEvent> getHistory(PluginEventType type) {
        List<PluginEvent> out = new ArrayList<>();
        for (PluginEvent e : getHistory()) {
            if (e.getType() == type) out.add(e);
        }
        return out;
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
