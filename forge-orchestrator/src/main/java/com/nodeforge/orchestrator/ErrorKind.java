package com.nodeforge.orchestrator;

import com.nodeforge.graph.CycleException;
import com.nodeforge.hooks.HookTimeoutException;
import com.nodeforge.lifecycle.LifecycleViolationException;
import com.nodeforge.plugin.CategoryException;
import com.nodeforge.plugin.DependencyException;
import com.nodeforge.plugin.DuplicatePluginException;
import com.nodeforge.plugin.ValidationException;

/** Classification of a failed plugin result. */
public enum ErrorKind {
    VALIDATION,
    CATEGORY,
    DUPLICATE,
    DEPENDENCY,
    CYCLE,
    TIMEOUT,
    EXECUTION,
    LIFECYCLE;

    /** Classifies a failure by its type, looking through causes for a hook timeout. */
    public static ErrorKind of(Throwable error) {
        if (error instanceof DependencyException) return DEPENDENCY;
        if (error instanceof LifecycleViolationException) return LIFECYCLE;
        if (error instanceof ValidationException) return VALIDATION;
        if (error instanceof CategoryException) return CATEGORY;
        if (error instanceof DuplicatePluginException) return DUPLICATE;
        if (error instanceof CycleException) return CYCLE;
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HookTimeoutException) return TIMEOUT;
            if (t.getCause() == t) break;
        }
        return EXECUTION;
    }
}
