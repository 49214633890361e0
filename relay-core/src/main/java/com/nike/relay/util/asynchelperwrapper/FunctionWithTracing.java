package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Function;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link Function} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class FunctionWithTracing<T, U> implements Function<T, U> {

    protected final Function<T, U> origFunction;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public FunctionWithTracing(Function<T, U> origFunction) {
        this(origFunction, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public FunctionWithTracing(Function<T, U> origFunction,
                               Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origFunction,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public FunctionWithTracing(Function<T, U> origFunction,
                               Segment segmentForExecution,
                               Map<String, String> mdcContextMapForExecution) {
        if (origFunction == null)
            throw new IllegalArgumentException("origFunction cannot be null");

        this.origFunction = origFunction;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static <T, U> FunctionWithTracing<T, U> withTracing(Function<T, U> origFunction) {
        return new FunctionWithTracing<>(origFunction);
    }

    public static <T, U> FunctionWithTracing<T, U> withTracing(Function<T, U> origFunction,
                                                                 Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new FunctionWithTracing<>(origFunction, originalThreadInfo);
    }

    public static <T, U> FunctionWithTracing<T, U> withTracing(Function<T, U> origFunction,
                                                                 Segment segmentForExecution,
                                                                 Map<String, String> mdcContextMapForExecution) {
        return new FunctionWithTracing<>(origFunction, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public U apply(T t) {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            return origFunction.apply(t);
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
