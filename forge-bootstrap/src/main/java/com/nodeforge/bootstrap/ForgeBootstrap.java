package com.nodeforge.bootstrap;

import com.nodeforge.annotations.ResourceCleanup;
import com.nodeforge.config.ForgeConfig;
import com.nodeforge.features.metrics.MetricsEventListener;
import com.nodeforge.hooks.HookScheduler;
import com.nodeforge.orchestrator.CategoryOrchestrator;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.PluginManager;
import com.nodeforge.plugin.PluginProvider;
import com.nodeforge.plugin.events.PluginEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link ForgeEngine} from configuration: creates the hook scheduler, event bus and
 * orchestrator, subscribes the metrics listener, then registers every enabled provider found on
 * the classpath and in the plugins directory.
 * <p>
 * Internal providers are part of the application: a descriptor that fails to register fails the
 * bootstrap. Community providers are isolated: a failing one is logged and skipped.
 */
public final class ForgeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ForgeBootstrap.class);

    private ForgeBootstrap() {
    }

    /** Loads {@link ForgeConfig} from the environment and discovers providers via the context class loader. */
    public static ForgeEngine initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return create(ForgeConfig.fromEnvironment());
    }

    public static ForgeEngine create(ForgeConfig config) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return create(config, loader != null ? loader : ForgeBootstrap.class.getClassLoader());
    }

    /**
     * @param loader class loader searched for internal {@link PluginProvider}s
     */
    public static ForgeEngine create(ForgeConfig config, ClassLoader loader) {
        Objects.requireNonNull(config, "config");
        log.info("Bootstrap: executionType={}, hookThreads={}, defaultHookTimeoutMs={}, eventHistorySize={}, metrics={}, pluginsDir={}",
                config.getExecutionType(), config.getHookThreads(), config.getDefaultHookTimeoutMillis(),
                config.getEventHistorySize(), config.isMetricsEnabled(), config.getPluginsDir());

        Duration defaultTimeout = config.getDefaultHookTimeoutMillis() > 0
                ? Duration.ofMillis(config.getDefaultHookTimeoutMillis()) : null;
        HookScheduler scheduler = new HookScheduler(config.getHookThreads(), defaultTimeout);
        PluginEventBus eventBus = new PluginEventBus(config.getEventHistorySize());
        CategoryOrchestrator orchestrator = new CategoryOrchestrator(scheduler, eventBus, config.getExecutionType());

        List<ResourceCleanup> cleanups = new ArrayList<>();
        if (config.isMetricsEnabled()) {
            MetricsEventListener metrics = new MetricsEventListener();
            eventBus.subscribe(metrics);
            cleanups.add(metrics);
        }

        PluginManager pluginManager = new PluginManager();
        try {
            pluginManager.discover(loader, config.getPluginsDir());
            int count = registerProviders(orchestrator, pluginManager);
            if (count == 0) {
                log.warn("No plugins registered; check internal providers and FORGE_PLUGINS_DIR for community JARs");
            }
        } catch (RuntimeException e) {
            orchestrator.onExit();
            scheduler.onExit();
            pluginManager.close();
            throw e;
        }
        return new ForgeEngine(config, orchestrator, scheduler, eventBus, pluginManager, cleanups);
    }

    private static int registerProviders(CategoryOrchestrator orchestrator, PluginManager pluginManager) {
        int count = 0;
        for (PluginProvider provider : pluginManager.getInternalProviders()) {
            if (!provider.isEnabled()) {
                log.info("Skipping disabled plugin provider {}", provider.getClass().getName());
                continue;
            }
            PluginDescriptor d = provider.getDescriptor();
            orchestrator.register(d.getCategoryName(), d);
            count++;
        }
        for (PluginProvider provider : pluginManager.getCommunityProviders()) {
            try {
                if (!provider.isEnabled()) continue;
                PluginDescriptor d = provider.getDescriptor();
                orchestrator.register(d.getCategoryName(), d);
                count++;
            } catch (RuntimeException e) {
                log.error("Community plugin failed to register (skipping): provider={}, error={}",
                        provider.getClass().getName(), e.getMessage(), e);
            }
        }
        return count;
    }
}
