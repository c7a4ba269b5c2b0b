package com.nodeforge.features.metrics;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.annotations.ResourceCleanup;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.events.PluginEvent;
import com.nodeforge.plugin.events.PluginEventListener;
import com.nodeforge.plugin.events.PluginEventType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Event bus listener that records plugin activity in a Micrometer registry: a counter per event
 * type and category, and an execution timer per plugin for executed and failed runs. Events
 * without a duration only count, as do failures outside a run (unmet dependencies, cleanup).
 */
public final class MetricsEventListener implements PluginEventListener, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(MetricsEventListener.class);

    public static final String EVENTS_COUNTER = "forge.plugin.events";
    public static final String EXECUTION_TIMER = "forge.plugin.execution";

    private static final Set<String> NON_RUN_PHASES = Set.of(
            PluginEvent.PHASE_DEPENDENCY, LifecycleEvent.CLEANUP.toValue(), "teardown");

    private final MeterRegistry registry;

    public MetricsEventListener() {
        this(new SimpleMeterRegistry());
    }

    public MetricsEventListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onEvent(PluginEvent event) {
        String category = categoryTag(event.getCategory());
        registry.counter(EVENTS_COUNTER,
                "type", event.getType().toValue(),
                "category", category
        ).increment();

        PluginEventType type = event.getType();
        boolean timed = type == PluginEventType.EXECUTED
                || (type == PluginEventType.FAILED && !NON_RUN_PHASES.contains(event.getPhase()));
        if (timed && event.getDurationMs() >= 0) {
            Timer.builder(EXECUTION_TIMER)
                    .tag("category", category)
                    .tag("plugin", nullToUnknown(event.getPluginName()))
                    .tag("success", String.valueOf(type == PluginEventType.EXECUTED))
                    .register(registry)
                    .record(event.getDurationMs(), TimeUnit.MILLISECONDS);
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private static String categoryTag(PluginCategory category) {
        return category != null ? category.toValue() : "unknown";
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }

    @Override
    public void onExit() {
        registry.close();
        log.debug("Metrics registry closed");
    }
}
