package com.nodeforge.hooks;

import com.nodeforge.annotations.LifecycleEvent;
import com.nodeforge.annotations.ResourceCleanup;
import com.nodeforge.executioncontext.PluginContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the ordered hooks of one lifecycle event.
 * <p>
 * For each hook in order: a condition that evaluates to false records {@link HookStatus#SKIPPED};
 * otherwise the handler runs, on the calling thread when no timeout applies, or on the hook pool
 * raced against its timeout. An expired hook is cancelled and recorded as
 * {@link HookStatus#TIMED_OUT}. A failing non-critical hook is recorded and the next hook runs; a
 * failing critical hook stops the event and {@link CriticalHookException} is thrown. Hooks are
 * never retried.
 */
public final class HookScheduler implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(HookScheduler.class);

    private static final int DEFAULT_CORE_THREADS = 4;

    private final ThreadPoolExecutor executor;
    private final Duration defaultTimeout;

    public HookScheduler() {
        this(DEFAULT_CORE_THREADS, null);
    }

    /**
     * @param coreThreads    threads kept for timed hooks; more are created on demand so a hung handler
     *                       never blocks another hook's timer
     * @param defaultTimeout timeout for hooks that declare none, or null for no timeout
     */
    public HookScheduler(int coreThreads, Duration defaultTimeout) {
        this.executor = new ThreadPoolExecutor(Math.max(1, coreThreads), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new HookThreadFactory());
        this.defaultTimeout = defaultTimeout != null && !defaultTimeout.isZero() && !defaultTimeout.isNegative()
                ? defaultTimeout : null;
    }

    /**
     * Runs the hooks in the given order.
     *
     * @return one outcome per hook
     * @throws CriticalHookException if a critical hook fails or times out
     */
    public List<HookOutcome> run(LifecycleEvent event, List<HookDescriptor> orderedHooks, PluginContext context) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(context, "context");
        List<HookOutcome> outcomes = new ArrayList<>();
        if (orderedHooks == null || orderedHooks.isEmpty()) {
            return outcomes;
        }
        for (HookDescriptor hook : orderedHooks) {
            HookOutcome outcome = runOne(event, hook, context);
            outcomes.add(outcome);
            if (outcome.isFailure()) {
                if (hook.isCritical()) {
                    log.warn("Critical hook {} on {} failed; skipping remaining {} hook(s): {}",
                            outcome.getHookName(), event, orderedHooks.size() - outcomes.size(), outcome.getErrorMessage());
                    throw new CriticalHookException(outcome.getHookName(), event, outcomes, outcome.getError());
                }
                log.warn("Hook {} on {} {}: {}", outcome.getHookName(), event,
                        outcome.getStatus() == HookStatus.TIMED_OUT ? "timed out" : "failed", outcome.getErrorMessage());
            }
        }
        return outcomes;
    }

    private HookOutcome runOne(LifecycleEvent event, HookDescriptor hook, PluginContext context) {
        String name = hook.getName() != null ? hook.getName() : event.toValue();
        long start = System.nanoTime();
        HookCondition condition = hook.getCondition();
        if (condition != null) {
            try {
                if (!condition.test(context)) {
                    log.debug("Hook {} on {} skipped by condition", name, event);
                    return HookOutcome.skipped(name, event);
                }
            } catch (Throwable e) {
                return HookOutcome.failed(name, event, e, elapsedMs(start));
            }
        }
        Duration timeout = hook.getTimeout() != null ? hook.getTimeout() : defaultTimeout;
        if (timeout == null) {
            try {
                Object result = hook.getHandler().handle(context);
                log.debug("Hook {} on {} succeeded in {} ms", name, event, elapsedMs(start));
                return HookOutcome.success(name, event, result, elapsedMs(start));
            } catch (Throwable e) {
                return HookOutcome.failed(name, event, e, elapsedMs(start));
            }
        }
        return runTimed(event, hook, name, timeout, context, start);
    }

    private HookOutcome runTimed(LifecycleEvent event, HookDescriptor hook, String name, Duration timeout,
                                 PluginContext context, long start) {
        Future<Object> future = executor.submit(() -> hook.getHandler().handle(context));
        try {
            Object result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Hook {} on {} succeeded in {} ms", name, event, elapsedMs(start));
            return HookOutcome.success(name, event, result, elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            return HookOutcome.timedOut(name, event, new HookTimeoutException(name, event, timeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return HookOutcome.failed(name, event, cause, elapsedMs(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return HookOutcome.failed(name, event,
                    new HookExecutionException(name, "Interrupted while waiting for hook " + name, e), elapsedMs(start));
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void onExit() {
        executor.shutdownNow();
        log.debug("Hook scheduler pool shut down");
    }

    private static final class HookThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "forge-hook-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
