package com.nodeforge.hooks;

import com.nodeforge.annotations.ForgeHook;
import com.nodeforge.annotations.LifecycleEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one hook: the event it attaches to, its handler and how it is scheduled
 * (priority, dependencies on other hooks of the same event, critical flag, condition, timeout).
 * <p>
 * Instances are immutable. The builder does not reject missing fields; structural problems are
 * reported together by the plugin descriptor validator.
 */
public final class HookDescriptor {

    /** Priority of hooks that declare none. */
    public static final int DEFAULT_PRIORITY = 50;

    private final String name;
    private final LifecycleEvent event;
    private final HookHandler handler;
    private final int priority;
    private final List<String> dependencies;
    private final boolean critical;
    private final HookCondition condition;
    private final Duration timeout;
    private final String description;

    private HookDescriptor(Builder b) {
        this.name = b.name != null && !b.name.isBlank() ? b.name.trim() : null;
        this.event = b.event;
        this.handler = b.handler;
        this.priority = b.priority;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(b.dependencies));
        this.critical = b.critical;
        this.condition = b.condition;
        this.timeout = b.timeout;
        this.description = b.description;
    }

    /** Hook name, or null until the owning plugin assigns a default. */
    public String getName() {
        return name;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public HookHandler getHandler() {
        return handler;
    }

    public int getPriority() {
        return priority;
    }

    /** Names of hooks on the same event that must run before this one. */
    public List<String> getDependencies() {
        return dependencies;
    }

    public boolean isCritical() {
        return critical;
    }

    /** Condition, or null when the hook always runs. */
    public HookCondition getCondition() {
        return condition;
    }

    /** Timeout, or null when the hook declares none. */
    public Duration getTimeout() {
        return timeout;
    }

    public String getDescription() {
        return description;
    }

    /** Returns a copy with the given name. */
    public HookDescriptor named(String newName) {
        return toBuilder().name(newName).build();
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .event(event)
                .handler(handler)
                .priority(priority)
                .dependencies(dependencies)
                .critical(critical)
                .condition(condition)
                .timeout(timeout)
                .description(description);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(LifecycleEvent event, HookHandler handler) {
        return new Builder().event(event).handler(handler);
    }

    /**
     * Reads the descriptor from the {@link ForgeHook} annotation on the handler's class.
     *
     * @throws IllegalArgumentException if the class is not annotated
     */
    public static HookDescriptor fromAnnotated(HookHandler handler) {
        Objects.requireNonNull(handler, "handler");
        ForgeHook ann = handler.getClass().getAnnotation(ForgeHook.class);
        if (ann == null) {
            throw new IllegalArgumentException("Hook handler must be annotated with @ForgeHook: " + handler.getClass().getName());
        }
        return builder(ann.event(), handler)
                .name(ann.name())
                .priority(ann.priority())
                .critical(ann.critical())
                .dependencies(Arrays.asList(ann.dependsOn()))
                .timeout(ann.timeoutMillis() > 0 ? Duration.ofMillis(ann.timeoutMillis()) : null)
                .build();
    }

    @Override
    public String toString() {
        return "HookDescriptor{" + event + ":" + name + ", priority=" + priority + (critical ? ", critical" : "") + "}";
    }

    public static final class Builder {
        private String name;
        private LifecycleEvent event;
        private HookHandler handler;
        private int priority = DEFAULT_PRIORITY;
        private List<String> dependencies = List.of();
        private boolean critical;
        private HookCondition condition;
        private Duration timeout;
        private String description;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder event(LifecycleEvent event) {
            this.event = event;
            return this;
        }

        public Builder handler(HookHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : List.of();
            return this;
        }

        public Builder dependsOn(String... hookNames) {
            return dependencies(Arrays.asList(hookNames));
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder condition(HookCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeout = Duration.ofMillis(timeoutMillis);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public HookDescriptor build() {
            return new HookDescriptor(this);
        }
    }
}
