package com.nodeforge.bootstrap;

import com.nodeforge.config.ExecutionType;
import com.nodeforge.config.ForgeConfig;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.lifecycle.PluginState;
import com.nodeforge.orchestrator.ExecutionResult;
import com.nodeforge.plugin.CategoryException;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.events.PluginEventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForgeBootstrapTest {

    @TempDir
    Path pluginsDir;

    private ForgeEngine engine(ForgeConfig.Builder config) {
        return ForgeBootstrap.create(config.pluginsDir(pluginsDir).build(), ForgeBootstrapTest.class.getClassLoader());
    }

    @Test
    void create_registersEnabledClasspathProviders() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            assertNotNull(engine.getOrchestrator().getPlugin(PluginCategory.ENVIRONMENT, "node-version-check"));
            assertEquals(2, engine.getPluginManager().getInternalProviders().size());
            assertTrue(engine.getPluginManager().getCommunityProviders().isEmpty());
            assertEquals(1, engine.getEventBus().getHistory(PluginEventType.REGISTERED).size());
        }
    }

    @Test
    void create_subscribesMetricsOnlyWhenEnabled() {
        try (ForgeEngine withMetrics = engine(ForgeConfig.builder());
             ForgeEngine withoutMetrics = engine(ForgeConfig.builder().metricsEnabled(false))) {
            assertEquals(1, withMetrics.getEventBus().getListenerCount());
            assertEquals(0, withoutMetrics.getEventBus().getListenerCount());
        }
    }

    @Test
    void syncEnvironment_passesActionAndOptions() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            List<ExecutionResult> results = engine.syncEnvironment(Map.of(PluginContext.PROJECT_PATH, "/work/app"));

            assertEquals(1, results.size());
            assertTrue(results.get(0).isSuccess());
            assertEquals("sync:/work/app", results.get(0).getResult());
        }
    }

    @Test
    void syncEnvironment_withoutProjectPathFailsContextValidation() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            ExecutionResult r = engine.syncEnvironment(Map.of()).get(0);

            assertFalse(r.isSuccess());
            assertEquals("pre-execute", r.getFailedPhase());
        }
    }

    @Test
    void manageDatabase_rejectsUnknownAction() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            engine.registerPlugin("database", PluginDescriptor.builder()
                    .name("pg-migrator").version("1.0.0").category("database")
                    .capability("migrations", true)
                    .body(ctx -> "migrated")
                    .build());

            ExecutionResult ok = engine.manageDatabase("migrate", Map.of(PluginContext.PROJECT_PATH, "/work/app")).get(0);
            ExecutionResult bad = engine.manageDatabase("drop", Map.of(PluginContext.PROJECT_PATH, "/work/app")).get(0);

            assertTrue(ok.isSuccess());
            assertFalse(bad.isSuccess());
            assertTrue(bad.getErrorMessage().contains("unsupported action 'drop'"), bad.getErrorMessage());
        }
    }

    @Test
    void categoriesWithoutPlugins_returnNoResults() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            assertTrue(engine.manageAPI(Map.of()).isEmpty());
            assertTrue(engine.manageMicroservices(Map.of()).isEmpty());
            assertTrue(engine.optimizePerformance(Map.of()).isEmpty());
            assertTrue(engine.analyzeSecurity(Map.of()).isEmpty());
        }
    }

    @Test
    void registerPlugin_rejectsUnknownCategory() {
        try (ForgeEngine engine = engine(ForgeConfig.builder())) {
            assertThrows(CategoryException.class, () -> engine.registerPlugin("frontend", PluginDescriptor.builder()
                    .name("x").version("1.0.0").category("frontend").body(ctx -> null).build()));
        }
    }

    @Test
    void analyzeProject_runsEveryCategory() {
        try (ForgeEngine engine = engine(ForgeConfig.builder().executionType(ExecutionType.ASYNC))) {
            List<ExecutionResult> results = engine.analyzeProject("/work/app");

            assertEquals(1, results.size());
            assertEquals("null:/work/app", results.get(0).getResult());
            assertThrows(IllegalArgumentException.class, () -> engine.analyzeProject(" "));
        }
    }

    @Test
    void close_cleansUpPluginsOnce() {
        ForgeEngine engine = engine(ForgeConfig.builder());
        engine.syncEnvironment(Map.of(PluginContext.PROJECT_PATH, "/work/app"));

        engine.close();
        engine.close();

        assertEquals(PluginState.CLEANED_UP,
                engine.getOrchestrator().describe(PluginCategory.ENVIRONMENT, "node-version-check").getState());
        assertEquals(1, engine.getEventBus().getHistory(PluginEventType.CLEANED_UP).size());
        assertNull(engine.getOrchestrator().getPlugin(PluginCategory.API, "node-version-check"));
    }
}
