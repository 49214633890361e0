package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link Runnable} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class RunnableWithTracing implements Runnable {

    protected final Runnable origRunnable;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public RunnableWithTracing(Runnable origRunnable) {
        this(origRunnable, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public RunnableWithTracing(Runnable origRunnable,
                               Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origRunnable,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public RunnableWithTracing(Runnable origRunnable,
                               Segment segmentForExecution,
                               Map<String, String> mdcContextMapForExecution) {
        if (origRunnable == null)
            throw new IllegalArgumentException("origRunnable cannot be null");

        this.origRunnable = origRunnable;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static RunnableWithTracing withTracing(Runnable origRunnable) {
        return new RunnableWithTracing(origRunnable);
    }

    public static RunnableWithTracing withTracing(Runnable origRunnable,
                                                    Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new RunnableWithTracing(origRunnable, originalThreadInfo);
    }

    public static RunnableWithTracing withTracing(Runnable origRunnable,
                                                    Segment segmentForExecution,
                                                    Map<String, String> mdcContextMapForExecution) {
        return new RunnableWithTracing(origRunnable, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public void run() {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            origRunnable.run();
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
