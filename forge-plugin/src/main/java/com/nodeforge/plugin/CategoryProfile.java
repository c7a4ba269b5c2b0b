package com.nodeforge.plugin;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.executioncontext.PluginContext;
import com.nodeforge.executioncontext.PluginStateStore;
import com.nodeforge.hooks.HookDescriptor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-category dispatch table: which capability names a plugin of the category may declare,
 * which actions its context may carry, and which hooks every plugin of the category gets before
 * its own.
 * <p>
 * database and environment plugins get a critical pre-execute {@value #CONTEXT_VALIDATION} hook
 * (non-blank project path, known action if one is given). database plugins also get
 * {@value #CONNECTION_CHECK}, which records {@value #CONNECTION_CHECKED} in the plugin's state store.
 */
public final class CategoryProfile {

    public static final String CONTEXT_VALIDATION = "context-validation";
    public static final String CONNECTION_CHECK = "connection-check";
    public static final String CONNECTION_CHECKED = "connectionChecked";

    /** Priority of built-in hooks; they run before plugin hooks of the default priority. */
    static final int BUILT_IN_PRIORITY = 0;

    private static final Map<PluginCategory, CategoryProfile> PROFILES = new EnumMap<>(PluginCategory.class);

    static {
        PROFILES.put(PluginCategory.API, new CategoryProfile(PluginCategory.API,
                Set.of("design", "mock", "test", "document", "monitor"), null, false));
        PROFILES.put(PluginCategory.DATABASE, new CategoryProfile(PluginCategory.DATABASE,
                Set.of("migrations", "seeding", "backup", "restore"),
                Set.of("migrate", "seed", "backup", "restore"), true));
        PROFILES.put(PluginCategory.ENVIRONMENT, new CategoryProfile(PluginCategory.ENVIRONMENT,
                Set.of("syncNodeVersion", "syncDependencies", "syncConfigs", "crossPlatform"),
                Set.of("sync", "check", "repair"), true));
        PROFILES.put(PluginCategory.SECURITY, new CategoryProfile(PluginCategory.SECURITY,
                Set.of("dependencyScan", "codeScan", "configScan", "reportGeneration"), null, false));
        PROFILES.put(PluginCategory.MICROSERVICES, new CategoryProfile(PluginCategory.MICROSERVICES, null, null, false));
        PROFILES.put(PluginCategory.PERFORMANCE, new CategoryProfile(PluginCategory.PERFORMANCE, null, null, false));
    }

    private final PluginCategory category;
    private final Set<String> allowedCapabilities;
    private final Set<String> actions;
    private final List<HookDescriptor> builtInHooks;

    private CategoryProfile(PluginCategory category, Set<String> allowedCapabilities, Set<String> actions,
                            boolean validatesContext) {
        this.category = category;
        this.allowedCapabilities = allowedCapabilities;
        this.actions = actions;
        this.builtInHooks = validatesContext ? builtIns(category, actions) : List.of();
    }

    public static CategoryProfile of(PluginCategory category) {
        return PROFILES.get(category);
    }

    public PluginCategory getCategory() {
        return category;
    }

    /** True when any capability name is accepted for the category. */
    public boolean acceptsAnyCapability() {
        return allowedCapabilities == null;
    }

    public boolean isCapabilityAllowed(String capability) {
        return allowedCapabilities == null || allowedCapabilities.contains(capability);
    }

    /** Allowed capability names; empty when any name is accepted. */
    public Set<String> getAllowedCapabilities() {
        return allowedCapabilities != null ? allowedCapabilities : Set.of();
    }

    /** Actions the context may name; empty when the category does not restrict actions. */
    public Set<String> getActions() {
        return actions != null ? actions : Set.of();
    }

    /** Hooks every plugin of the category runs, ahead of its own hooks on the same event. */
    public List<HookDescriptor> getBuiltInHooks() {
        return builtInHooks;
    }

    private static List<HookDescriptor> builtIns(PluginCategory category, Set<String> actions) {
        HookDescriptor validation = HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, ctx -> {
                    validateContext(category, actions, ctx);
                    return Boolean.TRUE;
                })
                .name(CONTEXT_VALIDATION)
                .priority(BUILT_IN_PRIORITY)
                .critical(true)
                .description("Rejects " + category + " contexts without a project path or with an unknown action")
                .build();
        if (category != PluginCategory.DATABASE) {
            return List.of(validation);
        }
        HookDescriptor connection = HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, ctx -> {
                    PluginStateStore store = ctx.getStore();
                    if (store != null) {
                        store.put(CONNECTION_CHECKED, Boolean.TRUE);
                    }
                    return Boolean.TRUE;
                })
                .name(CONNECTION_CHECK)
                .priority(BUILT_IN_PRIORITY)
                .dependsOn(CONTEXT_VALIDATION)
                .description("Marks the database connection as checked before execution")
                .build();
        return List.of(validation, connection);
    }

    private static void validateContext(PluginCategory category, Set<String> actions, PluginContext ctx) {
        String projectPath = ctx.getProjectPath();
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("Invalid " + category + " context: projectPath is required");
        }
        String action = ctx.getAction();
        if (action != null && actions != null && !actions.contains(action)) {
            throw new IllegalArgumentException("Invalid " + category + " context: unsupported action '" + action
                    + "' (expected one of " + actions + ")");
        }
    }
}
