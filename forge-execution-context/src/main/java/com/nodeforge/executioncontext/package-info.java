/**
 * Context objects passed through a plugin run: the immutable
 * {@link com.nodeforge.executioncontext.PluginContext} and the per-plugin
 * {@link com.nodeforge.executioncontext.PluginStateStore}.
 */
package com.nodeforge.executioncontext;
