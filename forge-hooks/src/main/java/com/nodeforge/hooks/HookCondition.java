package com.nodeforge.hooks;

import com.nodeforge.executioncontext.PluginContext;

/** Guard evaluated before a hook runs; false skips the hook. A throwing condition fails the hook. */
@FunctionalInterface
public interface HookCondition {

    boolean test(PluginContext context) throws Exception;
}
