package com.nodeforge.plugin;

/** Plugin-specific teardown, run after the cleanup hooks. */
@FunctionalInterface
public interface PluginTeardown {

    void teardown() throws Exception;
}
