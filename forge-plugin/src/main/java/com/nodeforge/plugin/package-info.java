/**
 * Plugin declarations and admission: {@link com.nodeforge.plugin.PluginDescriptor},
 * {@link com.nodeforge.plugin.PluginDescriptorValidator}, semantic {@link com.nodeforge.plugin.Version}s,
 * the per-category {@link com.nodeforge.plugin.CategoryProfile} dispatch table and the
 * {@link com.nodeforge.plugin.PluginRegistry}.
 * <p>
 * Discovery goes through the {@link com.nodeforge.plugin.PluginProvider} SPI and
 * {@link com.nodeforge.plugin.PluginManager}; metadata can be shipped as a JSON
 * {@link com.nodeforge.plugin.PluginManifest}.
 */
package com.nodeforge.plugin;
