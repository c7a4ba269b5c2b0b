package com.nodeforge.hooks;

import com.nodeforge.executioncontext.PluginContext;

/**
 * Callable attached to a lifecycle event. Returning normally records a success with the returned
 * value; throwing records a failure.
 */
@FunctionalInterface
public interface HookHandler {

    Object handle(PluginContext context) throws Exception;
}
