package com.nodeforge.hooks;

/** Outcome status of a single hook invocation. */
public enum HookStatus {
    SUCCESS,
    FAILED,
    /** Condition evaluated to false; the handler was not invoked. */
    SKIPPED,
    /** Handler did not finish within its timeout and was cancelled. */
    TIMED_OUT
}
