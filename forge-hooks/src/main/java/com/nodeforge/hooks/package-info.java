/**
 * Hooks attached to lifecycle events: {@link com.nodeforge.hooks.HookDescriptor} declarations,
 * per-plugin {@link com.nodeforge.hooks.HookTable}s resolved once at registration, and the
 * {@link com.nodeforge.hooks.HookScheduler} that runs one event's hooks with conditions,
 * timeouts and critical escalation.
 */
package com.nodeforge.hooks;
