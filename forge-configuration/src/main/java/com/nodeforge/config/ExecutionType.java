package com.nodeforge.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How project analysis runs categories: one after the other on the calling thread (default), or
 * concurrently on a pool. Plugins inside one category always run in resolved order.
 */
public enum ExecutionType {
    /** Run categories sequentially in the calling thread (default). */
    SYNC,
    /** Run categories concurrently; results are still concatenated in category order. */
    ASYNC;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static ExecutionType fromValue(String value) {
        if (value == null || value.isBlank()) return SYNC;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return SYNC;
        }
    }
}
