package com.nodeforge.orchestrator;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.config.ExecutionType;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.graph.CycleException;
import com.nodeforge.hooks.HookDescriptor;
import com.nodeforge.hooks.HookScheduler;
import com.nodeforge.hooks.HookStatus;
import com.nodeforge.lifecycle.PluginDiagnostics;
import com.nodeforge.lifecycle.PluginState;
import com.nodeforge.plugin.CategoryException;
import com.nodeforge.plugin.CategoryProfile;
import com.nodeforge.plugin.DuplicatePluginException;
import com.nodeforge.plugin.PluginCategory;
import com.nodeforge.plugin.PluginDescriptor;
import com.nodeforge.plugin.PluginNotFoundException;
import com.nodeforge.plugin.ValidationException;
import com.nodeforge.plugin.events.PluginEvent;
import com.nodeforge.plugin.events.PluginEventBus;
import com.nodeforge.plugin.events.PluginEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CategoryOrchestratorTest {

    private final HookScheduler scheduler = new HookScheduler();
    private final PluginEventBus bus = new PluginEventBus();
    private final CategoryOrchestrator orchestrator = new CategoryOrchestrator(scheduler, bus, ExecutionType.SYNC);
    private final PluginContext ctx = PluginContext.of(Map.of(PluginContext.PROJECT_PATH, "/tmp/x"));

    @AfterEach
    void tearDown() {
        orchestrator.onExit();
        scheduler.onExit();
    }

    private static PluginDescriptor.Builder apiPlugin(String name, List<String> calls) {
        return PluginDescriptor.builder()
                .name(name)
                .version("1.0.0")
                .category(PluginCategory.API)
                .capability("design", true)
                .body(c -> {
                    calls.add(name);
                    return name + "-done";
                });
    }

    private static PluginDescriptor.Builder databasePlugin(String name) {
        return PluginDescriptor.builder()
                .name(name)
                .version("1.0.0")
                .category(PluginCategory.DATABASE)
                .capability("migrations", true)
                .body(c -> name);
    }

    private static List<String> names(List<ExecutionResult> results) {
        return results.stream().map(ExecutionResult::getPluginName).collect(Collectors.toList());
    }

    @Test
    void applyPlugins_runsDependenciesFirst() {
        List<String> calls = new ArrayList<>();
        orchestrator.register("api", apiPlugin("b", calls).dependsOn("a", ">=1.0.0").build());
        orchestrator.register("api", apiPlugin("a", calls).build());

        List<ExecutionResult> results = orchestrator.applyPlugins("api", ctx);

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(ExecutionResult::isSuccess));
        assertEquals(List.of("a", "b"), names(results));
        assertEquals(List.of("a", "b"), calls);
        assertEquals("a-done", results.get(0).getResult());
        assertEquals(PluginCategory.API, results.get(0).getCategory());
    }

    @Test
    void applyPlugins_missingDependencyYieldsFailedResultWithoutThrowing() {
        orchestrator.register("database", databasePlugin("b").dependsOn("a", ">=1.0.0").build());

        List<ExecutionResult> results = orchestrator.applyPlugins("database", ctx);

        assertEquals(1, results.size());
        ExecutionResult r = results.get(0);
        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.DEPENDENCY, r.getErrorKind());
        assertTrue(r.getErrorMessage().contains("DependencyError"), r.getErrorMessage());
        assertTrue(r.getErrorMessage().contains("(missing)"), r.getErrorMessage());
        assertEquals(PluginState.REGISTERED, orchestrator.describe(PluginCategory.DATABASE, "b").getState());
        PluginEvent failed = bus.getHistory(PluginEventType.FAILED).get(0);
        assertEquals(PluginEvent.PHASE_DEPENDENCY, failed.getPhase());
        assertEquals(-1, failed.getDurationMs());
    }

    @Test
    void applyPlugins_excludesDependentsOfExcludedPlugins() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("base", calls).version("0.9.0").build());
        orchestrator.register(PluginCategory.API, apiPlugin("mid", calls).dependsOn("base", ">=1.0.0").build());
        orchestrator.register(PluginCategory.API, apiPlugin("top", calls).dependsOn("mid", "*").build());
        orchestrator.register(PluginCategory.API, apiPlugin("free", calls).build());

        List<ExecutionResult> results = orchestrator.applyPlugins(PluginCategory.API, ctx);

        assertEquals(List.of("base", "free", "mid", "top"), names(results));
        assertEquals(List.of("base", "free"), calls);
        ExecutionResult mid = results.get(2);
        ExecutionResult top = results.get(3);
        assertTrue(mid.getErrorMessage().contains("(found 0.9.0)"), mid.getErrorMessage());
        assertTrue(top.getErrorMessage().contains("(dependency failed)"), top.getErrorMessage());
        assertEquals(ErrorKind.DEPENDENCY, top.getErrorKind());
    }

    @Test
    void applyPlugins_isolatesFailingPlugin() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("broken", calls)
                .body(c -> {
                    throw new IllegalStateException("boom");
                })
                .build());
        orchestrator.register(PluginCategory.API, apiPlugin("healthy", calls).build());

        List<ExecutionResult> results = orchestrator.applyPlugins(PluginCategory.API, ctx);

        assertEquals(2, results.size());
        ExecutionResult broken = results.get(0);
        assertFalse(broken.isSuccess());
        assertEquals(ErrorKind.EXECUTION, broken.getErrorKind());
        assertEquals("execute", broken.getFailedPhase());
        assertTrue(broken.getErrorMessage().contains("boom"));
        assertTrue(results.get(1).isSuccess());
        assertEquals(PluginState.ERROR, orchestrator.describe(PluginCategory.API, "broken").getState());
        assertEquals(1, bus.getHistory(PluginEventType.FAILED).size());
    }

    @Test
    void applyPlugins_isolatesPluginThrowingError() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a-assert", calls)
                .body(c -> {
                    throw new AssertionError("boom");
                })
                .build());
        orchestrator.register(PluginCategory.API, apiPlugin("b-ok", calls).build());

        List<ExecutionResult> results = orchestrator.applyPlugins(PluginCategory.API, ctx);

        assertEquals(List.of("a-assert", "b-ok"), names(results));
        ExecutionResult failed = results.get(0);
        assertFalse(failed.isSuccess());
        assertEquals(ErrorKind.EXECUTION, failed.getErrorKind());
        assertEquals("execute", failed.getFailedPhase());
        assertTrue(failed.getErrorMessage().contains("boom"), failed.getErrorMessage());
        assertTrue(results.get(1).isSuccess());
        assertEquals(List.of("b-ok"), calls);

        PluginDiagnostics d = orchestrator.describe(PluginCategory.API, "a-assert");
        assertEquals(PluginState.ERROR, d.getState());
        assertEquals(1, d.getMetrics().getExecutionCount());
        assertEquals(1, d.getMetrics().getFailureCount());
        assertEquals(1, d.getMetrics().getErrorCount());
        assertEquals(1, bus.getHistory(PluginEventType.FAILED).size());
    }

    @Test
    void applyPlugins_isolatesUntimedCriticalHookThrowingError() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("deep", calls)
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> {
                    throw new StackOverflowError("deep");
                }).name("recurse").critical(true).build())
                .build());
        orchestrator.register(PluginCategory.API, apiPlugin("next", calls).build());

        List<ExecutionResult> results = orchestrator.applyPlugins(PluginCategory.API, ctx);

        ExecutionResult failed = results.get(0);
        assertFalse(failed.isSuccess());
        assertEquals("pre-execute", failed.getFailedPhase());
        assertEquals(HookStatus.FAILED, failed.getHookOutcomes().get(0).getStatus());
        assertTrue(results.get(1).isSuccess());
        assertEquals(List.of("next"), calls);
        assertEquals(PluginState.ERROR, orchestrator.describe(PluginCategory.API, "deep").getState());
    }

    @Test
    void applyPlugins_dependentOfFailedPluginStillRuns() {
        // a runtime failure is not an unmet dependency
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls)
                .body(c -> {
                    throw new IllegalStateException("boom");
                })
                .build());
        orchestrator.register(PluginCategory.API, apiPlugin("b", calls).dependsOn("a", "*").build());

        List<ExecutionResult> results = orchestrator.applyPlugins(PluginCategory.API, ctx);

        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(1).isSuccess());
        assertEquals(List.of("b"), calls);
    }

    @Test
    void applyPlugins_criticalHookTimeoutIsReportedAsTimeout() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("slow", calls)
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> {
                    Thread.sleep(2_000);
                    return null;
                }).name("wait").critical(true).timeoutMillis(50).build())
                .build());

        ExecutionResult r = orchestrator.applyPlugins(PluginCategory.API, ctx).get(0);

        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.TIMEOUT, r.getErrorKind());
        assertEquals("pre-execute", r.getFailedPhase());
        assertTrue(r.getErrorMessage().contains("TimeoutError"), r.getErrorMessage());
        assertEquals(HookStatus.TIMED_OUT, r.getHookOutcomes().get(0).getStatus());
        assertTrue(calls.isEmpty());
    }

    @Test
    void applyPlugins_databaseContextValidationFailsWithoutProjectPath() {
        orchestrator.register(PluginCategory.DATABASE, databasePlugin("migrator").build());

        ExecutionResult r = orchestrator.applyPlugins(PluginCategory.DATABASE, PluginContext.empty()).get(0);

        assertFalse(r.isSuccess());
        assertEquals("pre-execute", r.getFailedPhase());
        assertTrue(r.getErrorMessage().contains("projectPath is required"), r.getErrorMessage());
    }

    @Test
    void applyPlugins_databaseBuiltInsRunBeforePluginHooks() {
        orchestrator.register(PluginCategory.DATABASE, databasePlugin("migrator").build());

        ExecutionResult r = orchestrator.applyPlugins(PluginCategory.DATABASE, ctx).get(0);

        assertTrue(r.isSuccess());
        assertEquals(CategoryProfile.CONTEXT_VALIDATION, r.getHookOutcomes().get(0).getHookName());
        assertEquals(CategoryProfile.CONNECTION_CHECK, r.getHookOutcomes().get(1).getHookName());
        assertEquals(Boolean.TRUE,
                orchestrator.getPluginState(PluginCategory.DATABASE, "migrator", CategoryProfile.CONNECTION_CHECKED));
    }

    @Test
    void applyPlugins_pluginCycleIsThrown() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls).dependsOn("b", "*").build());
        orchestrator.register(PluginCategory.API, apiPlugin("b", calls).dependsOn("a", "*").build());

        CycleException e = assertThrows(CycleException.class,
                () -> orchestrator.applyPlugins(PluginCategory.API, ctx));
        assertTrue(e.getParticipants().containsAll(List.of("a", "b")));
        assertTrue(calls.isEmpty());
    }

    @Test
    void applyPlugins_emptyCategoryReturnsNoResults() {
        assertTrue(orchestrator.applyPlugins(PluginCategory.SECURITY, ctx).isEmpty());
    }

    @Test
    void unknownCategory_isRejected() {
        List<String> calls = new ArrayList<>();
        assertThrows(CategoryException.class, () -> orchestrator.applyPlugins("frontend", ctx));
        assertThrows(CategoryException.class, () -> orchestrator.register("frontend", apiPlugin("a", calls).build()));
    }

    @Test
    void register_rejectsDuplicateName() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls).build());

        assertThrows(DuplicatePluginException.class,
                () -> orchestrator.register(PluginCategory.API, apiPlugin("a", calls).version("2.0.0").build()));
        assertEquals("1.0.0", orchestrator.getPlugin(PluginCategory.API, "a").getVersion());
    }

    @Test
    void register_rejectsCategoryMismatch() {
        List<String> calls = new ArrayList<>();
        ValidationException e = assertThrows(ValidationException.class,
                () -> orchestrator.register(PluginCategory.SECURITY, apiPlugin("a", calls).build()));
        assertTrue(e.getMessage().contains("does not match"), e.getMessage());
        assertTrue(orchestrator.getPlugins(PluginCategory.SECURITY).isEmpty());
    }

    @Test
    void register_rejectsInvalidDescriptor() {
        List<String> calls = new ArrayList<>();
        assertThrows(ValidationException.class,
                () -> orchestrator.register(PluginCategory.API, apiPlugin("Bad Name", calls).build()));
        assertTrue(orchestrator.getPlugins(PluginCategory.API).isEmpty());
    }

    @Test
    void register_rejectsHookCycleAndAdmitsNothing() {
        List<String> calls = new ArrayList<>();
        PluginDescriptor d = apiPlugin("a", calls)
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> null).name("x").dependsOn("y").build(),
                        HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> null).name("y").dependsOn("x").build())
                .build();

        assertThrows(CycleException.class, () -> orchestrator.register(PluginCategory.API, d));
        assertNull(orchestrator.getPlugin(PluginCategory.API, "a"));
    }

    @Test
    void register_publishesEvent() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>()).build());

        assertEquals(1, bus.getHistory(PluginEventType.REGISTERED).size());
        assertEquals("a", bus.getHistory(PluginEventType.REGISTERED).get(0).getPluginName());
    }

    @Test
    void unregister_removesPlugin() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>()).build());

        assertEquals("a", orchestrator.unregister(PluginCategory.API, "a").getName());
        assertNull(orchestrator.unregister(PluginCategory.API, "a"));
        assertTrue(orchestrator.applyPlugins(PluginCategory.API, ctx).isEmpty());
        assertEquals(1, bus.getHistory(PluginEventType.UNREGISTERED).size());
    }

    @Test
    void cleanup_runsInReverseDependencyOrder() {
        List<String> torn = Collections.synchronizedList(new ArrayList<>());
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("b", calls).dependsOn("a", "*")
                .teardown(() -> torn.add("b")).build());
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls)
                .teardown(() -> torn.add("a")).build());
        orchestrator.applyPlugins(PluginCategory.API, ctx);

        List<ExecutionResult> results = orchestrator.cleanup(PluginCategory.API);

        assertEquals(List.of("b", "a"), torn);
        assertTrue(results.stream().allMatch(ExecutionResult::isSuccess));
        assertEquals(PluginState.CLEANED_UP, orchestrator.describe(PluginCategory.API, "a").getState());
    }

    @Test
    void cleanup_failingTeardownIsReportedAndOthersStillRun() {
        List<String> torn = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls).teardown(() -> torn.add("a")).build());
        orchestrator.register(PluginCategory.API, apiPlugin("b", calls).teardown(() -> {
            throw new IllegalStateException("stuck");
        }).build());

        List<ExecutionResult> results = orchestrator.cleanup(PluginCategory.API);

        assertEquals(List.of("b", "a"), names(results));
        assertFalse(results.get(0).isSuccess());
        assertEquals("teardown", results.get(0).getFailedPhase());
        assertEquals(List.of("a"), torn);
        assertEquals(PluginState.CLEANED_UP, orchestrator.describe(PluginCategory.API, "b").getState());
    }

    @Test
    void applyPlugins_afterCleanupReportsLifecycleViolation() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>()).build());
        orchestrator.cleanupAll();

        ExecutionResult r = orchestrator.applyPlugins(PluginCategory.API, ctx).get(0);

        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.LIFECYCLE, r.getErrorKind());
        assertTrue(r.getErrorMessage().contains("LifecycleError"), r.getErrorMessage());
    }

    @Test
    void removeHook_dropsHookFromLaterRuns() {
        List<String> calls = new ArrayList<>();
        orchestrator.register(PluginCategory.API, apiPlugin("a", calls)
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> {
                    calls.add("audit");
                    return null;
                }).name("audit").build())
                .build());

        assertTrue(orchestrator.removeHook(PluginCategory.API, "a", "audit"));
        assertFalse(orchestrator.removeHook(PluginCategory.API, "a", "audit"));
        orchestrator.applyPlugins(PluginCategory.API, ctx);

        assertEquals(List.of("a"), calls);
        PluginDiagnostics diagnostics = orchestrator.describe(PluginCategory.API, "a");
        assertFalse(diagnostics.getHookOrder().containsKey(LifecycleEvent.PRE_EXECUTE));
    }

    @Test
    void removeHook_rejectsRemovalOfDependedOnHook() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>())
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> null).name("first").build(),
                        HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, c -> null).name("second")
                                .dependsOn("first").build())
                .build());

        assertThrows(ValidationException.class, () -> orchestrator.removeHook(PluginCategory.API, "a", "first"));
        assertEquals(2, orchestrator.getPlugin(PluginCategory.API, "a").getHooks().size());
    }

    @Test
    void pluginState_isReadableAndWritable() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>())
                .body(c -> c.getStore().get("token"))
                .build());
        orchestrator.setPluginState(PluginCategory.API, "a", "token", "abc");

        assertEquals("abc", orchestrator.applyPlugins(PluginCategory.API, ctx).get(0).getResult());
        assertEquals("abc", orchestrator.getPluginState(PluginCategory.API, "a", "token"));
        assertThrows(PluginNotFoundException.class,
                () -> orchestrator.getPluginState(PluginCategory.API, "missing", "token"));
    }

    @Test
    void describe_reportsMetricsAfterRuns() {
        orchestrator.register(PluginCategory.API, apiPlugin("a", new ArrayList<>()).build());
        orchestrator.applyPlugins(PluginCategory.API, ctx);
        orchestrator.applyPlugins(PluginCategory.API, ctx);

        PluginDiagnostics d = orchestrator.describe(PluginCategory.API, "a");
        assertEquals(2, d.getMetrics().getExecutionCount());
        assertEquals(2, d.getMetrics().getSuccessCount());
        assertEquals(PluginState.EXECUTING, d.getState());
        assertThrows(PluginNotFoundException.class, () -> orchestrator.describe(PluginCategory.API, "nope"));
    }

    @Test
    void analyzeProject_concatenatesCategoriesInOrder() {
        assertAnalysisOrder(orchestrator);
    }

    @Test
    void analyzeProject_asyncKeepsCategoryOrder() {
        CategoryOrchestrator async = new CategoryOrchestrator(scheduler, bus, ExecutionType.ASYNC);
        try {
            assertAnalysisOrder(async);
        } finally {
            async.onExit();
        }
    }

    private void assertAnalysisOrder(CategoryOrchestrator o) {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        o.register(PluginCategory.DATABASE, databasePlugin("db").build());
        o.register(PluginCategory.API, apiPlugin("rest", calls).build());
        o.register(PluginCategory.SECURITY, PluginDescriptor.builder()
                .name("scanner").version("1.0.0").category(PluginCategory.SECURITY)
                .capability("codeScan", true).body(c -> "clean").build());

        List<ExecutionResult> results = o.analyzeProject(ctx);

        assertEquals(List.of("rest", "scanner", "db"), names(results));
        assertTrue(results.stream().allMatch(ExecutionResult::isSuccess));
    }
}
