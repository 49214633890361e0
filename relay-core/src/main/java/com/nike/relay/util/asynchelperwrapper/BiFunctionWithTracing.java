package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.BiFunction;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link BiFunction} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class BiFunctionWithTracing<T, U, R> implements BiFunction<T, U, R> {

    protected final BiFunction<T, U, R> origBiFunction;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public BiFunctionWithTracing(BiFunction<T, U, R> origBiFunction) {
        this(origBiFunction, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public BiFunctionWithTracing(BiFunction<T, U, R> origBiFunction,
                                 Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origBiFunction,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public BiFunctionWithTracing(BiFunction<T, U, R> origBiFunction,
                                 Segment segmentForExecution,
                                 Map<String, String> mdcContextMapForExecution) {
        if (origBiFunction == null)
            throw new IllegalArgumentException("origBiFunction cannot be null");

        this.origBiFunction = origBiFunction;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static <T, U, R> BiFunctionWithTracing<T, U, R> withTracing(BiFunction<T, U, R> origBiFunction) {
        return new BiFunctionWithTracing<>(origBiFunction);
    }

    public static <T, U, R> BiFunctionWithTracing<T, U, R> withTracing(BiFunction<T, U, R> origBiFunction,
                                                                         Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new BiFunctionWithTracing<>(origBiFunction, originalThreadInfo);
    }

    public static <T, U, R> BiFunctionWithTracing<T, U, R> withTracing(BiFunction<T, U, R> origBiFunction,
                                                                         Segment segmentForExecution,
                                                                         Map<String, String> mdcContextMapForExecution) {
        return new BiFunctionWithTracing<>(origBiFunction, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public R apply(T t, U u) {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            return origBiFunction.apply(t, u);
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
