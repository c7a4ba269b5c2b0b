package com.nodeforge.hooks;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.graph.DependencyGraphResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved, immutable hook lists per lifecycle event for one plugin. Each list is ordered by the
 * hook dependency graph of that event with priority as tie-break. A table is never mutated; adding
 * or removing hooks builds a new table with {@link #resolve(String, List)}.
 */
public final class HookTable {

    private static final HookTable EMPTY = new HookTable(new EnumMap<>(LifecycleEvent.class));

    private final Map<LifecycleEvent, List<HookDescriptor>> byEvent;

    private HookTable(EnumMap<LifecycleEvent, List<HookDescriptor>> byEvent) {
        this.byEvent = Collections.unmodifiableMap(byEvent);
    }

    public static HookTable empty() {
        return EMPTY;
    }

    /**
     * Groups the hooks by event and orders each group.
     *
     * @param owner plugin name, used in error messages
     * @param hooks named hooks in declaration order
     * @throws com.nodeforge.graph.CycleException if the hooks of one event depend on each other in a cycle
     * @throws IllegalArgumentException           if a hook depends on a hook not declared on the same event
     */
    public static HookTable resolve(String owner, List<HookDescriptor> hooks) {
        Objects.requireNonNull(hooks, "hooks");
        EnumMap<LifecycleEvent, List<HookDescriptor>> grouped = new EnumMap<>(LifecycleEvent.class);
        for (HookDescriptor h : hooks) {
            grouped.computeIfAbsent(h.getEvent(), e -> new ArrayList<>()).add(h);
        }
        EnumMap<LifecycleEvent, List<HookDescriptor>> resolved = new EnumMap<>(LifecycleEvent.class);
        for (Map.Entry<LifecycleEvent, List<HookDescriptor>> e : grouped.entrySet()) {
            DependencyGraphResolver<HookDescriptor> resolver = new DependencyGraphResolver<>(
                    "hooks of " + owner + " on " + e.getKey(),
                    HookDescriptor::getName,
                    HookDescriptor::getDependencies,
                    HookDescriptor::getPriority);
            resolved.put(e.getKey(), List.copyOf(resolver.order(e.getValue())));
        }
        return new HookTable(resolved);
    }

    /** Ordered hooks for the event; empty when none are attached. */
    public List<HookDescriptor> hooksFor(LifecycleEvent event) {
        return byEvent.getOrDefault(event, List.of());
    }

    /** All hooks, grouped in event order then resolved order. */
    public List<HookDescriptor> all() {
        List<HookDescriptor> out = new ArrayList<>();
        for (LifecycleEvent event : LifecycleEvent.values()) {
            out.addAll(hooksFor(event));
        }
        return out;
    }

    public int size() {
        int n = 0;
        for (List<HookDescriptor> l : byEvent.values()) n += l.size();
        return n;
    }
}
