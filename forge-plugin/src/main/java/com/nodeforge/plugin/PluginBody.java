package com.nodeforge.plugin;

import com.nodeforge.executioncontext.PluginContext;

/** The plugin's main callable. Its return value becomes the result of a successful run. */
@FunctionalInterface
public interface PluginBody {

    Object execute(PluginContext context) throws Exception;
}
