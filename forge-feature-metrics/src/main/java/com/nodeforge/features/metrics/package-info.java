/**
 * Micrometer metrics for plugin lifecycle events.
 */
package com.nodeforge.features.metrics;
