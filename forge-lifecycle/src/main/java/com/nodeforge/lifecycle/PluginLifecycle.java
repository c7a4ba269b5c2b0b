package com.nodeforge.lifecycle;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.hooks.CriticalHookException;
import com.nodeforge.hooks.HookDescriptor;
import com.nodeforge.hooks.HookOutcome;
import com.nodeforge.hooks.HookScheduler;
import com.nodeforge.hooks.HookTable;
import com.nodeforge.plugin.CategoryProfile;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.PluginInitializer;
import com.nodeforge.plugin.PluginTeardown;
import com.nodeforge.plugin.events.PluginEvent;
import com.nodeforge.plugin.events.PluginEventBus;
import com.nodeforge.plugin.events.PluginEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Lifecycle state machine of one admitted plugin.
 * <p>
 * {@link #initialize} runs pre-init hooks, the plugin initializer and post-init hooks.
 * {@link #execute} initializes first when needed, then runs pre-execute hooks, the body and
 * post-execute hooks. A failing phase moves the plugin to {@link PluginState#ERROR}, dispatches the
 * error hooks once (never re-entrantly, guarded by {@code dispatchingError}) and raises
 * {@link PluginExecutionException}. {@link #cleanup} runs cleanup hooks and teardown and always ends
 * in {@link PluginState#CLEANED_UP}. Metrics are updated before any exception leaves a phase.
 * <p>
 * Not thread-safe: one category run drives a plugin at a time.
 */
public final class PluginLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PluginLifecycle.class);

    static final String PHASE_INITIALIZE = "initialize";
    static final String PHASE_EXECUTE = "execute";
    static final String PHASE_TEARDOWN = "teardown";

    private final PluginCategory category;
    private final HookScheduler scheduler;
    private final PluginEventBus eventBus;
    private final PluginRuntimeState runtime = new PluginRuntimeState();

    private PluginDescriptor descriptor;
    private HookTable hooks;
    private boolean initialized;
    private boolean dispatchingError;
    private PluginContext lastContext;

    public PluginLifecycle(PluginCategory category, PluginDescriptor descriptor, HookTable hooks,
                           HookScheduler scheduler, PluginEventBus eventBus) {
        this.category = Objects.requireNonNull(category, "category");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    /**
     * Resolves the hook table of a descriptor: the category's built-in hooks followed by the
     * plugin's own, ordered per event.
     *
     * @throws com.nodeforge.graph.CycleException if hook dependencies of one event form a cycle
     */
    public static HookTable resolveHooks(PluginCategory category, PluginDescriptor descriptor) {
        List<HookDescriptor> all = new ArrayList<>(CategoryProfile.of(category).getBuiltInHooks());
        all.addAll(descriptor.getHooks());
        return HookTable.resolve(descriptor.getName(), all);
    }

    /** Moves an unregistered plugin to {@link PluginState#REGISTERED}. */
    public void markRegistered() {
        if (runtime.getState() != PluginState.UNREGISTERED) {
            throw new LifecycleViolationException(descriptor.getName(), runtime.getState(), "register");
        }
        runtime.setState(PluginState.REGISTERED);
    }

    /** Swaps in a new version of the descriptor and its re-resolved hook table (e.g. after hook removal). */
    public void update(PluginDescriptor newDescriptor, HookTable newHooks) {
        if (!descriptor.getName().equals(newDescriptor.getName())) {
            throw new IllegalArgumentException("Descriptor name cannot change: " + descriptor.getName()
                    + " -> " + newDescriptor.getName());
        }
        this.descriptor = newDescriptor;
        this.hooks = Objects.requireNonNull(newHooks, "newHooks");
    }

    public void initialize(PluginContext context) {
        initialize(context, null);
    }

    /**
     * Initializes the plugin; a no-op when it is already initialized.
     *
     * @param sink receives the hook outcomes of this call; may be null
     * @throws PluginExecutionException     if a hook, the initializer or a critical hook fails
     * @throws LifecycleViolationException  if the plugin is unregistered or cleaned up
     */
    public void initialize(PluginContext context, List<HookOutcome> sink) {
        requireRunnable(PHASE_INITIALIZE);
        if (initialized) {
            return;
        }
        PluginContext ctx = bind(context);
        long start = System.nanoTime();
        String phase = LifecycleEvent.PRE_INIT.toValue();
        try {
            runHooks(LifecycleEvent.PRE_INIT, ctx, sink);
            phase = PHASE_INITIALIZE;
            PluginInitializer initializer = descriptor.getInitializer();
            if (initializer != null) {
                initializer.initialize(ctx);
            }
            phase = LifecycleEvent.POST_INIT.toValue();
            runHooks(LifecycleEvent.POST_INIT, ctx, sink);
        } catch (Throwable e) {
            throw fail(ctx, phase, e, elapsedMs(start), sink);
        }
        initialized = true;
        runtime.setState(PluginState.INITIALIZED);
        log.info("Initialized plugin {}/{}@{} in {} ms", category, descriptor.getName(), descriptor.getVersion(), elapsedMs(start));
        eventBus.publish(PluginEvent.timed(PluginEventType.INITIALIZED, category, descriptor.getName(), elapsedMs(start)));
    }

    public Object execute(PluginContext context) {
        return execute(context, null);
    }

    /**
     * Runs the plugin once, initializing it first when needed.
     *
     * @param sink receives the hook outcomes of this call; may be null
     * @return the body's result
     * @throws PluginExecutionException    if any step fails
     * @throws LifecycleViolationException if the plugin is unregistered or cleaned up
     */
    public Object execute(PluginContext context, List<HookOutcome> sink) {
        requireRunnable(PHASE_EXECUTE);
        long start = System.nanoTime();
        runtime.recordExecutionStart(Instant.now());
        if (!initialized) {
            try {
                initialize(context, sink);
            } catch (PluginExecutionException e) {
                runtime.recordExecutionEnd(false, elapsedMs(start));
                throw e;
            }
        }
        PluginContext ctx = bind(context);
        runtime.setState(PluginState.EXECUTING);
        String phase = LifecycleEvent.PRE_EXECUTE.toValue();
        Object result;
        try {
            runHooks(LifecycleEvent.PRE_EXECUTE, ctx, sink);
            phase = PHASE_EXECUTE;
            result = descriptor.getBody().execute(ctx);
            phase = LifecycleEvent.POST_EXECUTE.toValue();
            runHooks(LifecycleEvent.POST_EXECUTE, ctx, sink);
        } catch (Throwable e) {
            runtime.recordExecutionEnd(false, elapsedMs(start));
            throw fail(ctx, phase, e, elapsedMs(start), sink);
        }
        long durationMs = elapsedMs(start);
        runtime.recordExecutionEnd(true, durationMs);
        log.debug("Executed plugin {}/{} in {} ms", category, descriptor.getName(), durationMs);
        eventBus.publish(PluginEvent.timed(PluginEventType.EXECUTED, category, descriptor.getName(), durationMs));
        return result;
    }

    public void cleanup() {
        cleanup(null);
    }

    /**
     * Runs cleanup hooks then teardown. Always ends in {@link PluginState#CLEANED_UP}; a no-op when
     * already cleaned up.
     *
     * @throws PluginExecutionException if a cleanup hook or the teardown fails (after the state change)
     */
    public void cleanup(List<HookOutcome> sink) {
        if (runtime.getState() == PluginState.CLEANED_UP) {
            return;
        }
        PluginContext ctx = bind(lastContext != null ? lastContext : PluginContext.empty());
        long start = System.nanoTime();
        String phase = LifecycleEvent.CLEANUP.toValue();
        Throwable failure = null;
        try {
            runHooks(LifecycleEvent.CLEANUP, ctx, sink);
            phase = PHASE_TEARDOWN;
            PluginTeardown teardown = descriptor.getTeardown();
            if (teardown != null) {
                teardown.teardown();
            }
        } catch (Throwable e) {
            failure = e;
        } finally {
            runtime.setState(PluginState.CLEANED_UP);
            initialized = false;
        }
        if (failure != null) {
            runtime.recordPhaseError();
            log.warn("Cleanup of plugin {}/{} failed in {}: {}", category, descriptor.getName(), phase, failure.getMessage());
            eventBus.publish(PluginEvent.failed(category, descriptor.getName(), elapsedMs(start), phase, failure.getMessage()));
            throw new PluginExecutionException(descriptor.getName(), phase, failure);
        }
        log.info("Cleaned up plugin {}/{}", category, descriptor.getName());
        eventBus.publish(PluginEvent.timed(PluginEventType.CLEANED_UP, category, descriptor.getName(), elapsedMs(start)));
    }

    private PluginExecutionException fail(PluginContext ctx, String phase, Throwable cause, long durationMs,
                                          List<HookOutcome> sink) {
        runtime.setState(PluginState.ERROR);
        runtime.recordPhaseError();
        log.warn("Plugin {}/{} failed in {}: {}", category, descriptor.getName(), phase, cause.getMessage());
        if (!dispatchingError) {
            dispatchingError = true;
            try {
                PluginContext errorCtx = ctx
                        .with(PluginContext.ERROR, cause)
                        .with(PluginContext.FAILED_PHASE, phase);
                runHooks(LifecycleEvent.ERROR, errorCtx, sink);
            } catch (CriticalHookException e) {
                log.warn("Error hook {} of plugin {} failed while handling {}: {}",
                        e.getHookName(), descriptor.getName(), phase, e.getMessage());
            } finally {
                dispatchingError = false;
            }
        }
        eventBus.publish(PluginEvent.failed(category, descriptor.getName(), durationMs, phase, cause.getMessage()));
        return new PluginExecutionException(descriptor.getName(), phase, cause);
    }

    private void runHooks(LifecycleEvent event, PluginContext ctx, List<HookOutcome> sink) {
        List<HookDescriptor> ordered = hooks.hooksFor(event);
        if (ordered.isEmpty()) {
            return;
        }
        List<HookOutcome> outcomes;
        try {
            outcomes = scheduler.run(event, ordered, ctx);
        } catch (CriticalHookException e) {
            record(e.getOutcomes(), sink);
            throw e;
        }
        record(outcomes, sink);
    }

    private void record(List<HookOutcome> outcomes, List<HookOutcome> sink) {
        runtime.recordHooks(outcomes);
        if (sink != null) {
            sink.addAll(outcomes);
        }
    }

    private void requireRunnable(String operation) {
        PluginState state = runtime.getState();
        if (state == PluginState.CLEANED_UP || state == PluginState.UNREGISTERED) {
            throw new LifecycleViolationException(descriptor.getName(), state, operation);
        }
    }

    private PluginContext bind(PluginContext context) {
        PluginContext base = context != null ? context : PluginContext.empty();
        lastContext = base;
        return base.forPlugin(descriptor.getName(), runtime);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public PluginDescriptor getDescriptor() {
        return descriptor;
    }

    public PluginCategory getCategory() {
        return category;
    }

    public PluginState getState() {
        return runtime.getState();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public PluginMetrics getMetrics() {
        return runtime.getMetrics();
    }

    /** The plugin's state store. */
    public PluginRuntimeState getRuntimeState() {
        return runtime;
    }

    public HookTable getHooks() {
        return hooks;
    }

    public PluginDiagnostics describe() {
        Map<LifecycleEvent, List<String>> order = new EnumMap<>(LifecycleEvent.class);
        for (LifecycleEvent event : LifecycleEvent.values()) {
            List<HookDescriptor> list = hooks.hooksFor(event);
            if (list.isEmpty()) continue;
            List<String> names = new ArrayList<>(list.size());
            for (HookDescriptor h : list) names.add(h.getName());
            order.put(event, List.copyOf(names));
        }
        return new PluginDiagnostics(descriptor.getName(), descriptor.getVersion(), category, runtime.getState(),
                runtime.getMetrics(), order, runtime.getHookStatistics(), runtime.keys());
    }
}
