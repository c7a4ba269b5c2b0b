package com.nodeforge.annotations;

/**
 * Contract for components that hold resources (thread pools, meter registries, class loaders) and
 * must release them when the engine shuts down. The engine calls {@link #onExit()} once on every
 * registered component when it is closed.
 */
public interface ResourceCleanup {

    /**
     * Releases resources. Implementations log their own failures instead of throwing so the
     * remaining components are still cleaned up.
     */
    void onExit();
}
