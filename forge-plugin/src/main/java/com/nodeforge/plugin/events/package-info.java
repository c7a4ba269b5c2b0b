/**
 * Plugin events ({@code plugin:registered}, {@code plugin:initialized}, {@code plugin:executed},
 * {@code plugin:error}, ...) and the observer-only {@link com.nodeforge.plugin.events.PluginEventBus}.
 */
package com.nodeforge.plugin.events;
