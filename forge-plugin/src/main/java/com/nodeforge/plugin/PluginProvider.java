package com.nodeforge.plugin;

/**
 * SPI for pluggable plugins. Implementations are discovered via {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.nodeforge.plugin.PluginProvider}), from the classpath or from JARs
 * in the plugins directory, and each provided descriptor is registered in its declared category.
 * Metadata can come from a {@link PluginManifest}; the provider supplies the callables.
 */
public interface PluginProvider {

    /** Descriptor to register. Called once per registration. */
    PluginDescriptor getDescriptor();

    /**
     * Whether this provider should be registered. Override to skip registration when a required
     * tool or setting is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
