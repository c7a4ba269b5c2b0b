package com.nodeforge.bootstrap;

import com.nodeforge.annotations.ResourceCleanup;
import com.nodeforge.config.ForgeConfig;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.hooks.HookScheduler;
import com.nodeforge.orchestrator.CategoryOrchestrator;
import com.nodeforge.orchestrator.ExecutionResult;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.PluginManager;
import com.nodeforge.plugin.events.PluginEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wired engine returned by {@link ForgeBootstrap}. Each action runs one category with the caller's
 * options plus the action name under {@link PluginContext#ACTION}. Closing runs plugin cleanup
 * and releases thread pools, metrics and community class loaders.
 */
public final class ForgeEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ForgeEngine.class);

    private final ForgeConfig config;
    private final CategoryOrchestrator orchestrator;
    private final HookScheduler scheduler;
    private final PluginEventBus eventBus;
    private final PluginManager pluginManager;
    private final List<ResourceCleanup> cleanups;
    private volatile boolean closed;

    ForgeEngine(ForgeConfig config, CategoryOrchestrator orchestrator, HookScheduler scheduler,
                PluginEventBus eventBus, PluginManager pluginManager, List<ResourceCleanup> cleanups) {
        this.config = Objects.requireNonNull(config, "config");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.pluginManager = Objects.requireNonNull(pluginManager, "pluginManager");
        this.cleanups = cleanups != null ? new ArrayList<>(cleanups) : List.of();
    }

    public void registerPlugin(String category, PluginDescriptor descriptor) {
        orchestrator.register(category, descriptor);
    }

    public List<ExecutionResult> syncEnvironment(Map<String, ?> options) {
        return run(PluginCategory.ENVIRONMENT, "sync", options);
    }

    public List<ExecutionResult> manageAPI(Map<String, ?> options) {
        return run(PluginCategory.API, "manage", options);
    }

    public List<ExecutionResult> manageMicroservices(Map<String, ?> options) {
        return run(PluginCategory.MICROSERVICES, "manage", options);
    }

    public List<ExecutionResult> optimizePerformance(Map<String, ?> options) {
        return run(PluginCategory.PERFORMANCE, "optimize", options);
    }

    public List<ExecutionResult> analyzeSecurity(Map<String, ?> options) {
        return run(PluginCategory.SECURITY, "analyze", options);
    }

    /** Runs database plugins for one of {@code migrate}, {@code seed}, {@code backup}, {@code restore}. */
    public List<ExecutionResult> manageDatabase(String action, Map<String, ?> options) {
        return run(PluginCategory.DATABASE, Objects.requireNonNull(action, "action"), options);
    }

    /**
     * Runs every category against the project.
     *
     * @throws IllegalArgumentException if projectPath is null or blank
     */
    public List<ExecutionResult> analyzeProject(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("Project path is required");
        }
        return orchestrator.analyzeProject(PluginContext.of(Map.of(PluginContext.PROJECT_PATH, projectPath)));
    }

    private List<ExecutionResult> run(PluginCategory category, String action, Map<String, ?> options) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (options != null) {
            attributes.putAll(options);
        }
        attributes.put(PluginContext.ACTION, action);
        log.debug("Running {} plugins for action {}", category, action);
        return orchestrator.applyPlugins(category, PluginContext.of(attributes));
    }

    public ForgeConfig getConfig() {
        return config;
    }

    public CategoryOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public PluginEventBus getEventBus() {
        return eventBus;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<ExecutionResult> results = orchestrator.cleanupAll();
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed > 0) {
            log.warn("{} plugin(s) failed to clean up on shutdown", failed);
        }
        for (ResourceCleanup c : cleanups) {
            try {
                c.onExit();
            } catch (RuntimeException e) {
                log.warn("Resource cleanup failed for {}: {}", c.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        orchestrator.onExit();
        scheduler.onExit();
        pluginManager.close();
        log.info("Engine closed");
    }
}
