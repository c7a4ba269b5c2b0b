package com.nodeforge.executioncontext;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginContextTest {

    @Test
    void of_copiesAttributesAndExposesWellKnownKeys() {
        Map<String, Object> source = new HashMap<>();
        source.put("projectPath", "/tmp/x");
        source.put("action", "sync");
        source.put("dryRun", Boolean.TRUE);
        PluginContext ctx = PluginContext.of(source);
        source.put("projectPath", "/changed");

        assertEquals("/tmp/x", ctx.getProjectPath());
        assertEquals("sync", ctx.getAction());
        assertEquals(Boolean.TRUE, ctx.get("dryRun", Boolean.class));
        assertNull(ctx.get("dryRun", String.class));
        assertThrows(UnsupportedOperationException.class, () -> ctx.getAttributes().put("k", "v"));
    }

    @Test
    void with_returnsCopyAndLeavesOriginalUntouched() {
        PluginContext ctx = PluginContext.of("/tmp/x", "check");
        PluginContext withError = ctx.with(PluginContext.FAILED_PHASE, "execute");

        assertFalse(ctx.containsKey(PluginContext.FAILED_PHASE));
        assertEquals("execute", withError.getString(PluginContext.FAILED_PHASE));
        assertEquals("/tmp/x", withError.getProjectPath());
    }

    @Test
    void forPlugin_bindsNameAndStore() {
        PluginStateStore store = new PluginStateStore() {
            private final Map<String, Object> values = new HashMap<>();

            @Override
            public Object get(String key) {
                return values.get(key);
            }

            @Override
            public void put(String key, Object value) {
                values.put(key, value);
            }

            @Override
            public Object remove(String key) {
                return values.remove(key);
            }

            @Override
            public Set<String> keys() {
                return Set.copyOf(values.keySet());
            }
        };
        PluginContext bound = PluginContext.empty().forPlugin("db-tools", store);
        bound.getStore().put("connectionChecked", true);

        assertEquals("db-tools", bound.getPluginName());
        assertSame(store, bound.with("k", 1).getStore());
        assertTrue(store.keys().contains("connectionChecked"));
        assertNull(PluginContext.empty().getStore());
    }
}
