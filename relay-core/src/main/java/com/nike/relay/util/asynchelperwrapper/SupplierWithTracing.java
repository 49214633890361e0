package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * A {@link Supplier} that wraps the given original so that the given segment and MDC information is registered with
 * the thread for the duration of each invocation, and the thread's previous tracing state is restored afterwards.
 * Invocations can happen any number of times, on any thread.
 */
@SuppressWarnings("WeakerAccess")
public class SupplierWithTracing<U> implements Supplier<U> {

    protected final Supplier<U> origSupplier;
    protected final Segment segmentForExecution;
    protected final Map<String, String> mdcContextMapForExecution;

    /**
     * Captures the current thread's ambient segment ({@link Tracer#getSegment()}) and MDC.
     *
     * <p>The operation you pass in cannot be null (an {@link IllegalArgumentException} will be thrown if you pass in
     * null for the operation).
     */
    public SupplierWithTracing(Supplier<U> origSupplier) {
        this(origSupplier, Tracer.getInstance().getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Uses the given tracing state. The {@link Pair} (or either side of it) can be null, in which case the operation
     * runs without an ambient segment and/or MDC. You can pass in a {@link TracingState}.
     */
    public SupplierWithTracing(Supplier<U> origSupplier,
                               Pair<Segment, Map<String, String>> originalThreadInfo) {
        this(
            origSupplier,
            (originalThreadInfo == null) ? null : originalThreadInfo.getLeft(),
            (originalThreadInfo == null) ? null : originalThreadInfo.getRight()
        );
    }

    /**
     * Uses the given segment and MDC information, either of which can be null.
     */
    public SupplierWithTracing(Supplier<U> origSupplier,
                               Segment segmentForExecution,
                               Map<String, String> mdcContextMapForExecution) {
        if (origSupplier == null)
            throw new IllegalArgumentException("origSupplier cannot be null");

        this.origSupplier = origSupplier;
        this.segmentForExecution = segmentForExecution;
        this.mdcContextMapForExecution = mdcContextMapForExecution;
    }

    public static <U> SupplierWithTracing<U> withTracing(Supplier<U> origSupplier) {
        return new SupplierWithTracing<>(origSupplier);
    }

    public static <U> SupplierWithTracing<U> withTracing(Supplier<U> origSupplier,
                                                           Pair<Segment, Map<String, String>> originalThreadInfo) {
        return new SupplierWithTracing<>(origSupplier, originalThreadInfo);
    }

    public static <U> SupplierWithTracing<U> withTracing(Supplier<U> origSupplier,
                                                           Segment segmentForExecution,
                                                           Map<String, String> mdcContextMapForExecution) {
        return new SupplierWithTracing<>(origSupplier, segmentForExecution, mdcContextMapForExecution);
    }

    public Segment getSegmentForExecution() {
        return segmentForExecution;
    }

    @Override
    public U get() {
        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segmentForExecution, mdcContextMapForExecution);

            return origSupplier.get();
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }
}
