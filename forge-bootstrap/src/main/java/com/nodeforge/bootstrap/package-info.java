/**
 * Engine wiring: {@link com.nodeforge.bootstrap.ForgeBootstrap} builds a
 * {@link com.nodeforge.bootstrap.ForgeEngine} from {@link com.nodeforge.config.ForgeConfig} and the
 * discovered plugin providers.
 */
package com.nodeforge.bootstrap;
