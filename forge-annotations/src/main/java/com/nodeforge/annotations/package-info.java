/**
 * Shared vocabulary for hooks: the {@link com.nodeforge.annotations.LifecycleEvent} set, the
 * {@link com.nodeforge.annotations.ForgeHook} annotation and the
 * {@link com.nodeforge.annotations.ResourceCleanup} shutdown contract.
 */
package com.nodeforge.annotations;
