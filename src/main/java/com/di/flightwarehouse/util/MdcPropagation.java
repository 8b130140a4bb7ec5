package com.di.flightwarehouse.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Propagates SLF4J MDC ({@code runId}, {@code stage}) from the orchestrator thread to the
 * stage worker threads, so that logs written by parallel stages stay correlated with their run.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code future.thenApplyAsync(MdcPropagation.wrapFunction(r -> next(r)), pool)}</li>
 *   <li>Or wrap the executor once: {@code ExecutorService withMdc = MdcPropagation.wrapExecutor(pool);}</li>
 *   <li>Scope a key around a block: {@code MdcPropagation.callWithMdcValue("stage", "load_flights", () -> ...)}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the task.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            Map<String, String> previous = copyMdc();
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                restoreMdc(previous);
            }
        };
    }

    /**
     * Captures the current thread's MDC and returns a Function that sets it while applying {@code fn}.
     * Suits {@code CompletableFuture.thenApplyAsync}, whose callback may run on any pool thread.
     */
    public static <T, R> Function<T, R> wrapFunction(Function<T, R> fn) {
        Map<String, String> contextMap = copyMdc();
        return input -> {
            Map<String, String> previous = copyMdc();
            setMdc(contextMap);
            try {
                return fn.apply(input);
            } finally {
                restoreMdc(previous);
            }
        };
    }

    /**
     * Runs the callable with {@code key=value} in MDC, restoring the previous value afterwards.
     *
     * @throws Exception if the callable throws
     */
    public static <T> T callWithMdcValue(String key, String value, Callable<T> task) throws Exception {
        String previous = MDC.get(key);
        MDC.put(key, value);
        try {
            return task.call();
        } finally {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * Returns a copy of the current thread's MDC context map; never null.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void restoreMdc(Map<String, String> previous) {
        MDC.clear();
        setMdc(previous);
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
