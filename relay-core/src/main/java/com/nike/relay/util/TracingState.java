package com.nike.relay.util;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.Transaction;
import com.nike.relay.util.asynchelperwrapper.RunnableWithTracing;

import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * DTO for holding/passing a thread's tracing information around: the ambient {@link Segment} and the MDC context.
 * Since this extends {@code Pair<Segment, Map<String, String>>} you can use it with the async wrapper constructors
 * (like {@link RunnableWithTracing#RunnableWithTracing(Runnable, Pair)}) and the {@code AsyncRelayHelper.*WithTracing}
 * methods.
 */
@SuppressWarnings("WeakerAccess")
public class TracingState extends Pair<Segment, Map<String, String>> {

    /**
     * The ambient segment, may be null.
     */
    public final Segment segment;
    /**
     * The MDC context, may be null.
     */
    public final Map<String, String> mdcInfo;

    public TracingState(Segment segment, Map<String, String> mdcInfo) {
        this.segment = segment;
        this.mdcInfo = mdcInfo;
    }

    /**
     * @return The current thread's tracing state, from {@link Tracer#getCurrentTracingStateCopy()}.
     */
    public static TracingState getCurrentThreadTracingState() {
        return Tracer.getInstance().getCurrentTracingStateCopy();
    }

    @Override
    public Segment getLeft() {
        return segment;
    }

    @Override
    public Map<String, String> getRight() {
        return mdcInfo;
    }

    /**
     * This method is not supported - create a new {@link TracingState} rather than modifying this one.
     */
    @Override
    public Map<String, String> setValue(Map<String, String> value) {
        throw new UnsupportedOperationException("TracingState is immutable - please create a new TracingState instead");
    }

    /**
     * @return The transaction of {@link #segment}, or null.
     */
    public @Nullable Transaction getTransaction() {
        return (segment == null) ? null : segment.getTransaction();
    }
}
