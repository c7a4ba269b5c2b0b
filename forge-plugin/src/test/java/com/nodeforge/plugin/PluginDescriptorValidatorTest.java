package com.nodeforge.plugin;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.hooks.HookDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginDescriptorValidatorTest {

    private final PluginDescriptorValidator validator = new PluginDescriptorValidator();

    private static PluginDescriptor.Builder valid() {
        return PluginDescriptor.builder()
                .name("openapi-generator")
                .version("1.2.0")
                .category(PluginCategory.API)
                .capability("design", true)
                .capability("document", false)
                .body(ctx -> "report written");
    }

    private static boolean mentions(ValidationResult r, String fragment) {
        return r.getErrors().stream().anyMatch(e -> e.contains(fragment));
    }

    @Test
    void validate_acceptsWellFormedDescriptor() {
        ValidationResult r = validator.validate(valid()
                .dependsOn("api-core", ">=1.0.0")
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, ctx -> null).name("prepare").build())
                .build());

        assertTrue(r.isValid(), () -> r.getErrors().toString());
    }

    @Test
    void validate_collectsEveryMissingField() {
        ValidationResult r = validator.validate(PluginDescriptor.builder().build());

        assertFalse(r.isValid());
        assertTrue(mentions(r, "name is required"));
        assertTrue(mentions(r, "version is required"));
        assertTrue(mentions(r, "category is required"));
        assertTrue(mentions(r, "at least one capability"));
        assertTrue(mentions(r, "execute is required"));
    }

    @Test
    void validate_rejectsBadNameVersionAndCategory() {
        ValidationResult r = validator.validate(valid().name("Bad_Name").version("1.0").category("mobile").build());

        assertTrue(mentions(r, "lowercase letters"));
        assertTrue(mentions(r, "semantic versioning"));
        assertTrue(mentions(r, "category 'mobile'"));
    }

    @Test
    void validate_rejectsCapabilityOutsideCategory() {
        ValidationResult r = validator.validate(valid().capability("migrations", true).build());

        assertTrue(mentions(r, "capability 'migrations' is not supported by api"));
    }

    @Test
    void validate_acceptsAnyCapabilityForOpenCategories() {
        ValidationResult r = validator.validate(valid().category(PluginCategory.PERFORMANCE)
                .capabilities(java.util.Map.of("bundleAnalysis", true)).build());

        assertTrue(r.isValid(), () -> r.getErrors().toString());
    }

    @Test
    void validate_checksDependencies() {
        ValidationResult r = validator.validate(valid()
                .dependsOn("openapi-generator", "*")
                .dependsOn("api-core", "latest")
                .dependsOn("api-core", "1.0.0")
                .dependsOn("", "1.0.0")
                .build());

        assertTrue(mentions(r, "cannot depend on itself"));
        assertTrue(mentions(r, "malformed version requirement 'latest'"));
        assertTrue(mentions(r, "declared more than once"));
        assertTrue(mentions(r, "has no name"));
    }

    @Test
    void validate_checksHooks() {
        ValidationResult r = validator.validate(valid().hooks(List.of(
                HookDescriptor.builder().name("no-event").handler(ctx -> null).build(),
                HookDescriptor.builder(LifecycleEvent.POST_EXECUTE, null).name("no-handler").build(),
                HookDescriptor.builder(LifecycleEvent.POST_EXECUTE, ctx -> null).name("dup").build(),
                HookDescriptor.builder(LifecycleEvent.POST_EXECUTE, ctx -> null).name("dup").build(),
                HookDescriptor.builder(LifecycleEvent.PRE_INIT, ctx -> null).name("zero").timeoutMillis(0).build(),
                HookDescriptor.builder(LifecycleEvent.PRE_INIT, ctx -> null).name("orphan").dependsOn("dup").build()
        )).build());

        assertTrue(mentions(r, "'no-event' has no event"));
        assertTrue(mentions(r, "'no-handler' has no handler"));
        assertTrue(mentions(r, "'dup' is used more than once"));
        assertTrue(mentions(r, "'zero' timeout must be positive"));
        assertTrue(mentions(r, "'orphan' depends on 'dup'"));
    }

    @Test
    void validate_hookMayDependOnCategoryBuiltIn() {
        ValidationResult r = validator.validate(PluginDescriptor.builder()
                .name("prisma-database")
                .version("2.0.0")
                .category(PluginCategory.DATABASE)
                .capability("migrations", true)
                .body(ctx -> null)
                .hook(HookDescriptor.builder(LifecycleEvent.PRE_EXECUTE, ctx -> null)
                        .name("load-schema")
                        .dependsOn(CategoryProfile.CONNECTION_CHECK)
                        .build())
                .build());

        assertTrue(r.isValid(), () -> r.getErrors().toString());
    }

    @Test
    void unnamedHooksGetPositionalNames() {
        PluginDescriptor d = valid()
                .hook(HookDescriptor.builder(LifecycleEvent.POST_INIT, ctx -> null).build())
                .build();

        assertEquals("post-init#0", d.getHooks().get(0).getName());
    }

    @Test
    void throwIfInvalid_raisesValidationException() {
        ValidationResult r = validator.validate(valid().version("x").build());

        ValidationException e = assertThrows(ValidationException.class, () -> r.throwIfInvalid("openapi-generator"));
        assertEquals(r.getErrors(), e.getErrors());
        assertTrue(e.getMessage().startsWith("ValidationError"));
    }
}
