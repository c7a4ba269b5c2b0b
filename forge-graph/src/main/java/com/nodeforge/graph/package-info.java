/**
 * Deterministic dependency ordering shared by plugin-level and hook-level resolution.
 */
package com.nodeforge.graph;
