package com.nodeforge.plugin;

import com.nodeforge.executioncontext.PluginContext;

/** Plugin-specific initialization, run between the pre-init and post-init hooks. */
@FunctionalInterface
public interface PluginInitializer {

    void initialize(PluginContext context) throws Exception;
}
