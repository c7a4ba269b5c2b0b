/**
 * Category orchestration. {@link com.nodeforge.orchestrator.CategoryOrchestrator} admits plugins and
 * runs a category's plugins in dependency order, converting each plugin's failure into an
 * {@link com.nodeforge.orchestrator.ExecutionResult} instead of aborting the run.
 */
package com.nodeforge.orchestrator;
