package com.nodeforge.orchestrator;

import com.nodeforge.annotations.ResourceCleanup;
import com.nodeforge.config.ExecutionType;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.graph.CycleException;
import com.nodeforge.graph.DependencyGraphResolver;
import com.nodeforge.hooks.HookOutcome;
import com.nodeforge.hooks.HookScheduler;
import com.nodeforge.hooks.HookTable;
import com.nodeforge.lifecycle.PluginDiagnostics;
import com.nodeforge.lifecycle.PluginExecutionException;
import com.nodeforge.lifecycle.PluginLifecycle;
import com.nodeforge.plugin.DependencyException;
import com.nodeforge.plugin.DependencySpec;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.PluginDescriptorValidator;
import com.nodeforge.plugin.PluginNotFoundException;
import com.nodeforge.plugin.PluginRegistry;
import com.nodeforge.plugin.ValidationException;
import com.nodeforge.plugin.Version;
import com.nodeforge.plugin.events.PluginEvent;
import com.nodeforge.plugin.events.PluginEventBus;
import com.nodeforge.plugin.events.PluginEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the engine: admits plugins per category and runs them.
 * <p>
 * {@link #applyPlugins(PluginCategory, PluginContext)} snapshots the category, turns unmet
 * dependencies into failed results (excluding the plugin and everything depending on it),
 * resolves the remaining plugins into dependency order and runs each one's lifecycle. A plugin
 * failure becomes a failed {@link ExecutionResult} and the run continues; only engine misuse
 * (unknown category, dependency cycle) is thrown.
 * <p>
 * Explicitly constructed and passed to callers; there is no shared instance. Registration must
 * not run concurrently with a run of the same category.
 */
public final class CategoryOrchestrator implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(CategoryOrchestrator.class);

    private final PluginRegistry registry = new PluginRegistry();
    private final PluginDescriptorValidator validator = new PluginDescriptorValidator();
    private final Map<PluginCategory, Map<String, PluginLifecycle>> lifecycles = new EnumMap<>(PluginCategory.class);
    private final HookScheduler scheduler;
    private final PluginEventBus eventBus;
    private final ExecutionType executionType;
    private final boolean ownsScheduler;
    private volatile ExecutorService analysisExecutor;

    /** Sequential orchestrator with its own hook scheduler and event bus. */
    public CategoryOrchestrator() {
        this(new HookScheduler(), new PluginEventBus(), ExecutionType.SYNC, true);
    }

    public CategoryOrchestrator(HookScheduler scheduler, PluginEventBus eventBus, ExecutionType executionType) {
        this(scheduler, eventBus, executionType, false);
    }

    private CategoryOrchestrator(HookScheduler scheduler, PluginEventBus eventBus, ExecutionType executionType,
                                 boolean ownsScheduler) {
        this.ownsScheduler = ownsScheduler;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.executionType = executionType != null ? executionType : ExecutionType.SYNC;
        for (PluginCategory c : PluginCategory.values()) {
            lifecycles.put(c, new ConcurrentHashMap<>());
        }
    }

    /**
     * Admits a plugin into a category given by name.
     *
     * @throws com.nodeforge.plugin.CategoryException if the category is unknown
     * @see #register(PluginCategory, PluginDescriptor)
     */
    public void register(String category, PluginDescriptor descriptor) {
        register(PluginCategory.fromValue(category), descriptor);
    }

    /**
     * Validates and admits a plugin. Its hook table is resolved here, once.
     *
     * @throws ValidationException                          if the descriptor is malformed or declares another category
     * @throws com.nodeforge.plugin.DuplicatePluginException if the name is taken in the category
     * @throws CycleException                               if hook dependencies of one event form a cycle
     */
    public void register(PluginCategory category, PluginDescriptor descriptor) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(descriptor, "descriptor");
        validator.validate(descriptor).throwIfInvalid(descriptor.getName());
        if (descriptor.getCategory() != category) {
            throw new ValidationException(descriptor.getName(), List.of(
                    "declared category '" + descriptor.getCategoryName() + "' does not match " + category));
        }
        HookTable hooks = PluginLifecycle.resolveHooks(category, descriptor);
        registry.register(category, descriptor);
        PluginLifecycle lifecycle = new PluginLifecycle(category, descriptor, hooks, scheduler, eventBus);
        lifecycle.markRegistered();
        lifecycles.get(category).put(descriptor.getName(), lifecycle);
        log.info("Registered plugin {}/{}@{} with {} hook(s)", category, descriptor.getName(),
                descriptor.getVersion(), hooks.size());
        eventBus.publish(PluginEvent.of(PluginEventType.REGISTERED, category, descriptor.getName()));
    }

    /**
     * Removes a plugin from its category. Cleanup is not run; call {@link #cleanup(PluginCategory)} first
     * if the plugin holds resources.
     *
     * @return the removed descriptor, or null if it was not registered
     */
    public PluginDescriptor unregister(PluginCategory category, String name) {
        PluginDescriptor removed = registry.unregister(category, name);
        if (removed == null) {
            return null;
        }
        lifecycles.get(category).remove(name);
        log.info("Unregistered plugin {}/{}", category, name);
        eventBus.publish(PluginEvent.of(PluginEventType.UNREGISTERED, category, name));
        return removed;
    }

    /**
     * Removes one of the plugin's own hooks and re-resolves its hook table. Built-in category hooks
     * cannot be removed.
     *
     * @return false when the plugin has no hook of that name
     * @throws PluginNotFoundException if the plugin is not registered
     * @throws ValidationException     if another hook still depends on the removed one
     */
    public boolean removeHook(PluginCategory category, String pluginName, String hookName) {
        PluginLifecycle lifecycle = requireLifecycle(category, pluginName);
        PluginDescriptor current = lifecycle.getDescriptor();
        boolean present = current.getHooks().stream().anyMatch(h -> h != null && hookName.equals(h.getName()));
        if (!present) {
            return false;
        }
        PluginDescriptor updated = current.withoutHook(hookName);
        validator.validate(updated).throwIfInvalid(pluginName);
        HookTable hooks = PluginLifecycle.resolveHooks(category, updated);
        registry.replace(category, updated);
        lifecycle.update(updated, hooks);
        log.info("Removed hook {} from plugin {}/{}", hookName, category, pluginName);
        return true;
    }

    /** Returns the admitted descriptor, or null. */
    public PluginDescriptor getPlugin(PluginCategory category, String name) {
        return registry.get(category, name);
    }

    /** Admitted descriptors of the category in registration order. */
    public List<PluginDescriptor> getPlugins(PluginCategory category) {
        return registry.snapshot(category);
    }

    public List<ExecutionResult> applyPlugins(String category, PluginContext context) {
        return applyPlugins(PluginCategory.fromValue(category), context);
    }

    /**
     * Runs every admitted plugin of the category once, in dependency order.
     *
     * @return one result per plugin: executed plugins in run order, then plugins excluded for
     *         unmet dependencies in registration order
     * @throws CycleException if the admitted plugins' dependencies form a cycle
     */
    public List<ExecutionResult> applyPlugins(PluginCategory category, PluginContext context) {
        Objects.requireNonNull(category, "category");
        PluginContext ctx = context != null ? context : PluginContext.empty();
        List<PluginDescriptor> snapshot = registry.snapshot(category);
        Map<String, PluginLifecycle> runtimes = new LinkedHashMap<>(lifecycles.get(category));

        Map<String, DependencyException> excluded = findUnmetDependencies(snapshot);
        List<PluginDescriptor> runnable = new ArrayList<>();
        for (PluginDescriptor d : snapshot) {
            if (!excluded.containsKey(d.getName())) runnable.add(d);
        }
        List<PluginDescriptor> ordered = orderOf(category, runnable);

        List<ExecutionResult> results = new ArrayList<>(snapshot.size());
        for (PluginDescriptor d : ordered) {
            PluginLifecycle lifecycle = runtimes.get(d.getName());
            if (lifecycle == null) {
                continue;
            }
            results.add(run(category, lifecycle, ctx));
        }
        for (PluginDescriptor d : snapshot) {
            DependencyException e = excluded.get(d.getName());
            if (e != null) {
                log.warn("Skipping plugin {}/{}: {}", category, d.getName(), e.getMessage());
                eventBus.publish(PluginEvent.failed(category, d.getName(), -1L,
                        PluginEvent.PHASE_DEPENDENCY, e.getMessage()));
                results.add(ExecutionResult.failure(d.getName(), d.getVersion(), category, e.getMessage(),
                        ErrorKind.DEPENDENCY, null, DurationMetrics.none(), List.of()));
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Applied {} plugin(s) in category {}: {} succeeded, {} failed",
                results.size(), category, results.size() - failed, failed);
        return results;
    }

    private ExecutionResult run(PluginCategory category, PluginLifecycle lifecycle, PluginContext ctx) {
        PluginDescriptor d = lifecycle.getDescriptor();
        List<HookOutcome> outcomes = new ArrayList<>();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        try {
            Object result = lifecycle.execute(ctx, outcomes);
            return ExecutionResult.success(d.getName(), d.getVersion(), category, result,
                    metrics(startedAt, start, outcomes), outcomes);
        } catch (Throwable e) {
            String phase = e instanceof PluginExecutionException ? ((PluginExecutionException) e).getFailedPhase() : null;
            return ExecutionResult.failure(d.getName(), d.getVersion(), category, e.getMessage(), ErrorKind.of(e),
                    phase, metrics(startedAt, start, outcomes), outcomes);
        }
    }

    private static DurationMetrics metrics(Instant startedAt, long startNanos, List<HookOutcome> outcomes) {
        long hookMs = 0;
        for (HookOutcome o : outcomes) hookMs += o.getDurationMs();
        return new DurationMetrics(startedAt, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), hookMs);
    }

    /**
     * Finds plugins whose dependencies are not admitted, are too old, or are themselves excluded.
     * Iterates to a fixpoint so exclusion propagates along dependency chains.
     */
    private static Map<String, DependencyException> findUnmetDependencies(List<PluginDescriptor> snapshot) {
        Map<String, PluginDescriptor> byName = new LinkedHashMap<>();
        for (PluginDescriptor d : snapshot) byName.put(d.getName(), d);

        Map<String, DependencyException> excluded = new LinkedHashMap<>();
        for (PluginDescriptor d : snapshot) {
            List<String> unmet = new ArrayList<>();
            for (DependencySpec dep : d.getDependencies()) {
                PluginDescriptor found = byName.get(dep.getName());
                if (found == null) {
                    unmet.add(dep + " (missing)");
                } else if (!dep.requirement().isSatisfiedBy(Version.parse(found.getVersion()))) {
                    unmet.add(dep + " (found " + found.getVersion() + ")");
                }
            }
            if (!unmet.isEmpty()) {
                excluded.put(d.getName(), new DependencyException(d.getName(), unmet));
            }
        }
        boolean changed = !excluded.isEmpty();
        while (changed) {
            changed = false;
            for (PluginDescriptor d : snapshot) {
                if (excluded.containsKey(d.getName())) continue;
                List<String> unmet = new ArrayList<>();
                for (String dep : d.getDependencyNames()) {
                    if (excluded.containsKey(dep)) unmet.add(dep + " (dependency failed)");
                }
                if (!unmet.isEmpty()) {
                    excluded.put(d.getName(), new DependencyException(d.getName(), unmet));
                    changed = true;
                }
            }
        }
        return excluded;
    }

    private static List<PluginDescriptor> orderOf(PluginCategory category, List<PluginDescriptor> plugins) {
        Set<String> present = new HashSet<>();
        for (PluginDescriptor d : plugins) present.add(d.getName());
        DependencyGraphResolver<PluginDescriptor> resolver = new DependencyGraphResolver<>(
                "category " + category,
                PluginDescriptor::getName,
                d -> {
                    List<String> deps = new ArrayList<>(d.getDependencyNames());
                    deps.retainAll(present);
                    return deps;
                },
                PluginDescriptor::getPriority);
        return resolver.order(plugins);
    }

    /**
     * Runs cleanup for every plugin of the category in reverse dependency order (reverse
     * registration order when the dependencies form a cycle). A failing cleanup is reported and
     * the next plugin is still cleaned up.
     */
    public List<ExecutionResult> cleanup(PluginCategory category) {
        List<PluginDescriptor> snapshot = registry.snapshot(category);
        List<PluginDescriptor> ordered;
        try {
            ordered = new ArrayList<>(orderOf(category, snapshot));
        } catch (CycleException e) {
            log.warn("Cleaning up category {} in registration order: {}", category, e.getMessage());
            ordered = new ArrayList<>(snapshot);
        }
        Collections.reverse(ordered);
        List<ExecutionResult> results = new ArrayList<>(ordered.size());
        for (PluginDescriptor d : ordered) {
            PluginLifecycle lifecycle = lifecycles.get(category).get(d.getName());
            if (lifecycle == null) continue;
            List<HookOutcome> outcomes = new ArrayList<>();
            Instant startedAt = Instant.now();
            long start = System.nanoTime();
            try {
                lifecycle.cleanup(outcomes);
                results.add(ExecutionResult.success(d.getName(), d.getVersion(), category, null,
                        metrics(startedAt, start, outcomes), outcomes));
            } catch (PluginExecutionException e) {
                results.add(ExecutionResult.failure(d.getName(), d.getVersion(), category, e.getMessage(),
                        ErrorKind.of(e), e.getFailedPhase(), metrics(startedAt, start, outcomes), outcomes));
            }
        }
        return results;
    }

    /** Cleans up every category, in category order. */
    public List<ExecutionResult> cleanupAll() {
        List<ExecutionResult> results = new ArrayList<>();
        for (PluginCategory c : PluginCategory.values()) {
            results.addAll(cleanup(c));
        }
        return results;
    }

    /**
     * Runs every category against the same context and concatenates the results in category
     * order. With {@link ExecutionType#ASYNC} categories run concurrently.
     *
     * @throws CycleException if any category's dependencies form a cycle
     */
    public List<ExecutionResult> analyzeProject(PluginContext context) {
        List<ExecutionResult> results = new ArrayList<>();
        if (executionType == ExecutionType.SYNC) {
            for (PluginCategory c : PluginCategory.values()) {
                results.addAll(applyPlugins(c, context));
            }
            return results;
        }
        ExecutorService executor = analysisExecutor();
        List<Future<List<ExecutionResult>>> futures = new ArrayList<>();
        for (PluginCategory c : PluginCategory.values()) {
            futures.add(executor.submit(() -> applyPlugins(c, context)));
        }
        for (Future<List<ExecutionResult>> f : futures) {
            try {
                results.addAll(f.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                throw new IllegalStateException("Category analysis failed", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted during project analysis", e);
            }
        }
        return results;
    }

    private ExecutorService analysisExecutor() {
        ExecutorService existing = analysisExecutor;
        if (existing != null) return existing;
        synchronized (this) {
            if (analysisExecutor == null) {
                analysisExecutor = Executors.newFixedThreadPool(PluginCategory.values().length, r -> {
                    Thread t = new Thread(r, "forge-analysis");
                    t.setDaemon(true);
                    return t;
                });
            }
            return analysisExecutor;
        }
    }

    /**
     * Diagnostics of one plugin.
     *
     * @throws PluginNotFoundException if the plugin is not registered
     */
    public PluginDiagnostics describe(PluginCategory category, String name) {
        return requireLifecycle(category, name).describe();
    }

    /** Reads a value from a plugin's state store. */
    public Object getPluginState(PluginCategory category, String name, String key) {
        return requireLifecycle(category, name).getRuntimeState().get(key);
    }

    /** Writes a value into a plugin's state store; null removes the key. */
    public void setPluginState(PluginCategory category, String name, String key, Object value) {
        requireLifecycle(category, name).getRuntimeState().put(key, value);
    }

    /** Lifecycle of an admitted plugin, for callers that drive phases themselves. */
    public PluginLifecycle getLifecycle(PluginCategory category, String name) {
        return requireLifecycle(category, name);
    }

    private PluginLifecycle requireLifecycle(PluginCategory category, String name) {
        PluginLifecycle lifecycle = lifecycles.get(Objects.requireNonNull(category, "category")).get(name);
        if (lifecycle == null) {
            throw new PluginNotFoundException(category, name);
        }
        return lifecycle;
    }

    public PluginEventBus getEventBus() {
        return eventBus;
    }

    public ExecutionType getExecutionType() {
        return executionType;
    }

    @Override
    public void onExit() {
        ExecutorService executor = analysisExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
        if (ownsScheduler) {
            scheduler.onExit();
        }
    }
}
