package com.nodeforge.plugin;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Category-scoped registry of admitted plugin descriptors by category and plugin name. A name is
 * unique within its category. Snapshots list plugins in registration order, which is the
 * declaration order used as the final ordering tie-break.
 * <p>
 * Not a singleton: each orchestrator owns its registry. Maps are concurrent so a snapshot can be
 * taken while another thread registers; callers serialize registration against runs.
 */
public final class PluginRegistry {

    /** category → (plugin name → entry) */
    private final Map<PluginCategory, Map<String, Entry>> pluginsByCategory = new EnumMap<>(PluginCategory.class);
    private final AtomicLong sequence = new AtomicLong();

    public PluginRegistry() {
        for (PluginCategory c : PluginCategory.values()) {
            pluginsByCategory.put(c, new ConcurrentHashMap<>());
        }
    }

    /**
     * Registers the descriptor under its name in the category.
     *
     * @throws DuplicatePluginException if the name is already registered in the category
     */
    public void register(PluginCategory category, PluginDescriptor descriptor) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(descriptor, "descriptor");
        String name = Objects.requireNonNull(descriptor.getName(), "descriptor.name");
        Entry entry = new Entry(sequence.incrementAndGet(), descriptor);
        if (pluginsByCategory.get(category).putIfAbsent(name, entry) != null) {
            throw new DuplicatePluginException(category, name);
        }
    }

    /**
     * Replaces an admitted descriptor with a new version of itself, keeping its registration order.
     *
     * @throws PluginNotFoundException if no plugin of that name is registered
     */
    public void replace(PluginCategory category, PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        Entry updated = pluginsByCategory.get(Objects.requireNonNull(category, "category"))
                .computeIfPresent(descriptor.getName(), (k, old) -> new Entry(old.sequence, descriptor));
        if (updated == null) {
            throw new PluginNotFoundException(category, descriptor.getName());
        }
    }

    /** Returns the descriptor, or null if not registered. */
    public PluginDescriptor get(PluginCategory category, String name) {
        if (category == null || name == null) return null;
        Entry e = pluginsByCategory.get(category).get(name);
        return e != null ? e.descriptor : null;
    }

    public boolean contains(PluginCategory category, String name) {
        return get(category, name) != null;
    }

    /** Removes and returns the descriptor, or null if it was not registered. */
    public PluginDescriptor unregister(PluginCategory category, String name) {
        if (category == null || name == null) return null;
        Entry e = pluginsByCategory.get(category).remove(name);
        return e != null ? e.descriptor : null;
    }

    /** Descriptors of the category in registration order. */
    public List<PluginDescriptor> snapshot(PluginCategory category) {
        List<Entry> entries = new ArrayList<>(pluginsByCategory.get(Objects.requireNonNull(category, "category")).values());
        entries.sort(Comparator.comparingLong(e -> e.sequence));
        List<PluginDescriptor> out = new ArrayList<>(entries.size());
        for (Entry e : entries) out.add(e.descriptor);
        return out;
    }

    public int size(PluginCategory category) {
        return pluginsByCategory.get(category).size();
    }

    private static final class Entry {
        final long sequence;
        final PluginDescriptor descriptor;

        Entry(long sequence, PluginDescriptor descriptor) {
            this.sequence = sequence;
            this.descriptor = descriptor;
        }
    }
}
