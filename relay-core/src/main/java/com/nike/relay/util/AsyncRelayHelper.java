package com.nike.relay.util;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.asynchelperwrapper.BiFunctionWithTracing;
import com.nike.relay.util.asynchelperwrapper.CallableWithTracing;
import com.nike.relay.util.asynchelperwrapper.ConsumerWithTracing;
import com.nike.relay.util.asynchelperwrapper.ExecutorServiceWithTracing;
import com.nike.relay.util.asynchelperwrapper.FunctionWithTracing;
import com.nike.relay.util.asynchelperwrapper.RunnableWithTracing;
import com.nike.relay.util.asynchelperwrapper.ScheduledExecutorServiceWithTracing;
import com.nike.relay.util.asynchelperwrapper.SupplierWithTracing;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Static helpers for moving a transaction's tracing state across threads. The {@code *WithTracing(...)} methods
 * without a tracing state argument capture the calling thread's ambient segment and MDC; the others use the state you
 * pass in. For example:
 *
 * <pre>
 *      import static com.nike.relay.util.AsyncRelayHelper.*;
 *
 *      // ...
 *
 *      CompletableFuture.supplyAsync(supplierWithTracing(() -> {
 *          // The request's ambient segment is available here.
 *          return fetchSomething();
 *      }), executor);
 * </pre>
 *
 * <p>{@link #linkTracingToCurrentThread(Segment, Map)} and {@link #unlinkTracingFromCurrentThread(Pair)} are the low
 * level pair all wrappers are built on: link returns the thread's previous state, and unlink (in a finally block)
 * restores it exactly.
 *
 * @author Nic Munroe
 */
@SuppressWarnings("WeakerAccess")
public class AsyncRelayHelper {

    // Intentionally protected - use the static methods.
    protected AsyncRelayHelper() { /* do nothing */ }

    public static Runnable runnableWithTracing(Runnable runnable) {
        return new RunnableWithTracing(runnable);
    }

    public static Runnable runnableWithTracing(Runnable runnable, Pair<Segment, Map<String, String>> threadInfoToLink) {
        return new RunnableWithTracing(runnable, threadInfoToLink);
    }

    public static <U> Callable<U> callableWithTracing(Callable<U> callable) {
        return new CallableWithTracing<>(callable);
    }

    public static <U> Callable<U> callableWithTracing(Callable<U> callable,
                                                      Pair<Segment, Map<String, String>> threadInfoToLink) {
        return new CallableWithTracing<>(callable, threadInfoToLink);
    }

    public static <U> Supplier<U> supplierWithTracing(Supplier<U> supplier) {
        return new SupplierWithTracing<>(supplier);
    }

    public static <U> Supplier<U> supplierWithTracing(Supplier<U> supplier,
                                                      Pair<Segment, Map<String, String>> threadInfoToLink) {
        return new SupplierWithTracing<>(supplier, threadInfoToLink);
    }

    public static <T, U> Function<T, U> functionWithTracing(Function<T, U> fn) {
        return new FunctionWithTracing<>(fn);
    }

    public static <T, U> Function<T, U> functionWithTracing(Function<T, U> fn,
                                                            Pair<Segment, Map<String, String>> threadInfoToLink) {
        return new FunctionWithTracing<>(fn, threadInfoToLink);
    }

    public static <T, U, R> BiFunction<T, U, R> biFunctionWithTracing(BiFunction<T, U, R> fn) {
        return new BiFunctionWithTracing<>(fn);
    }

    public static <T, U, R> BiFunction<T, U, R> biFunctionWithTracing(
        BiFunction<T, U, R> fn,
        Pair<Segment, Map<String, String>> threadInfoToLink
    ) {
        return new BiFunctionWithTracing<>(fn, threadInfoToLink);
    }

    public static <T> Consumer<T> consumerWithTracing(Consumer<T> consumer) {
        return new ConsumerWithTracing<>(consumer);
    }

    public static <T> Consumer<T> consumerWithTracing(Consumer<T> consumer,
                                                      Pair<Segment, Map<String, String>> threadInfoToLink) {
        return new ConsumerWithTracing<>(consumer, threadInfoToLink);
    }

    public static ExecutorServiceWithTracing executorServiceWithTracing(ExecutorService delegate) {
        return new ExecutorServiceWithTracing(delegate);
    }

    public static ScheduledExecutorServiceWithTracing scheduledExecutorServiceWithTracing(
        ScheduledExecutorService delegate
    ) {
        return new ScheduledExecutorServiceWithTracing(delegate);
    }

    /**
     * {@link CompletableFuture#supplyAsync(Supplier, Executor)} with the supplier bound to the calling thread's
     * tracing state.
     */
    public static <U> CompletableFuture<U> supplyAsyncWithTracing(Supplier<U> supplier, Executor executor) {
        return CompletableFuture.supplyAsync(supplierWithTracing(supplier), executor);
    }

    /**
     * {@link CompletableFuture#runAsync(Runnable, Executor)} with the runnable bound to the calling thread's tracing
     * state.
     */
    public static CompletableFuture<Void> runAsyncWithTracing(Runnable runnable, Executor executor) {
        return CompletableFuture.runAsync(runnableWithTracing(runnable), executor);
    }

    /**
     * Calls {@link #linkTracingToCurrentThread(Segment, Map)} with the two sides of the given pair, which may be null.
     */
    public static TracingState linkTracingToCurrentThread(Pair<Segment, Map<String, String>> threadInfoToLink) {
        Segment segment = (threadInfoToLink == null) ? null : threadInfoToLink.getLeft();
        Map<String, String> mdcContextMap = (threadInfoToLink == null) ? null : threadInfoToLink.getRight();

        return linkTracingToCurrentThread(segment, mdcContextMap);
    }

    /**
     * Makes the given segment ambient on the current thread and replaces the MDC with the given context map (a null
     * map clears the MDC).
     *
     * @return The thread's previous segment and MDC, to hand to {@link #unlinkTracingFromCurrentThread(Pair)} when the
     * work is done. Always do that in a finally block.
     */
    public static TracingState linkTracingToCurrentThread(Segment segmentToLink,
                                                          Map<String, String> mdcContextMapToLink) {
        // Unregister first so registering the desired segment never trips over what was already there.
        Map<String, String> callingThreadMdcContextMap = MDC.getCopyOfContextMap();
        Segment callingThreadSegment = Tracer.getInstance().unregisterFromThread();

        if (mdcContextMapToLink == null)
            MDC.clear();
        else
            MDC.setContextMap(mdcContextMapToLink);

        Tracer.getInstance().registerWithThread(segmentToLink);

        return new TracingState(callingThreadSegment, callingThreadMdcContextMap);
    }

    /**
     * Restores the tracing state returned by {@link #linkTracingToCurrentThread(Segment, Map)}. A null argument leaves
     * the thread with no ambient segment and an empty MDC.
     */
    public static void unlinkTracingFromCurrentThread(Pair<Segment, Map<String, String>> threadInfoToResetFor) {
        Segment segmentToResetFor = (threadInfoToResetFor == null) ? null : threadInfoToResetFor.getLeft();
        Map<String, String> mdcContextMapToResetFor = (threadInfoToResetFor == null)
                                                      ? null
                                                      : threadInfoToResetFor.getRight();

        unlinkTracingFromCurrentThread(segmentToResetFor, mdcContextMapToResetFor);
    }

    public static void unlinkTracingFromCurrentThread(Segment segmentToResetFor,
                                                      Map<String, String> mdcContextMapToResetFor) {
        Tracer.getInstance().unregisterFromThread();
        MDC.clear();

        if (mdcContextMapToResetFor != null)
            MDC.setContextMap(mdcContextMapToResetFor);

        if (segmentToResetFor != null)
            Tracer.getInstance().registerWithThread(segmentToResetFor);
    }
}
