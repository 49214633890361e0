package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link Callable} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class CallableWithTracing<U> implements Callable<U> {

    protected final Callable<U> origCallable;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public CallableWithTracing(Callable<U> origCallable) {
        this(origCallable, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public CallableWithTracing(Callable<U> origCallable,
                               Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origCallable,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public CallableWithTracing(Callable<U> origCallable,
                               Segment segmentForExecution,
                               Map<String, String> mdcContextMapForExecution) {
        if (origCallable == null)
            throw new IllegalArgumentException("origCallable cannot be null");

        this.origCallable = origCallable;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static <U> CallableWithTracing<U> withTracing(Callable<U> origCallable) {
        return new CallableWithTracing<>(origCallable);
    }

    public static <U> CallableWithTracing<U> withTracing(Callable<U> origCallable,
                                                           Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new CallableWithTracing<>(origCallable, originalThreadInfo);
    }

    public static <U> CallableWithTracing<U> withTracing(Callable<U> origCallable,
                                                           Segment segmentForExecution,
                                                           Map<String, String> mdcContextMapForExecution) {
        return new CallableWithTracing<>(origCallable, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public U call() throws Exception {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            return origCallable.call();
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
