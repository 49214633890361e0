package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Consumer;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link Consumer} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class ConsumerWithTracing<T> implements Consumer<T> {

    protected final Consumer<T> origConsumer;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public ConsumerWithTracing(Consumer<T> origConsumer) {
        this(origConsumer, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public ConsumerWithTracing(Consumer<T> origConsumer,
                               Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origConsumer,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public ConsumerWithTracing(Consumer<T> origConsumer,
                               Segment segmentForExecution,
                               Map<String, String> mdcContextMapForExecution) {
        if (origConsumer == null)
            throw new IllegalArgumentException("origConsumer cannot be null");

        this.origConsumer = origConsumer;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static <T> ConsumerWithTracing<T> withTracing(Consumer<T> origConsumer) {
        return new ConsumerWithTracing<>(origConsumer);
    }

    public static <T> ConsumerWithTracing<T> withTracing(Consumer<T> origConsumer,
                                                           Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new ConsumerWithTracing<>(origConsumer, originalThreadInfo);
    }

    public static <T> ConsumerWithTracing<T> withTracing(Consumer<T> origConsumer,
                                                           Segment segmentForExecution,
                                                           Map<String, String> mdcContextMapForExecution) {
        return new ConsumerWithTracing<>(origConsumer, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public void accept(T t) {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            origConsumer.accept(t);
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
