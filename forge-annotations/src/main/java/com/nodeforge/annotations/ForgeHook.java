package com.nodeforge.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a hook handler class so a hook descriptor can be read from the class instead of being
 * built by hand. The handler still has to implement the hook handler contract.
 * <p>
 * {@link #dependsOn()} names other hooks on the same event of the same plugin that must run first.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ForgeHook {

    /** Hook name, unique per event within a plugin. */
    String name();

    /** Event the hook attaches to. */
    LifecycleEvent event();

    /** Lower runs earlier among hooks not ordered by dependencies. */
    int priority() default 50;

    /** When true, a failure aborts the remaining hooks of the event and propagates. */
    boolean critical() default false;

    /** Names of hooks on the same event that must run before this one. */
    String[] dependsOn() default { };

    /** Timeout in milliseconds; 0 means no hook-level timeout. */
    long timeoutMillis() default 0;
}
