package com.nike.relay.metrics;

import org.jetbrains.annotations.Nullable;

/**
 * Receives the measurements produced by {@link SegmentRecorder}s when a transaction is finalized. Aggregation and
 * shipping to a collector happen behind this interface.
 */
public interface MetricSink {

    /**
     * @param name The metric name, e.g. {@code External/example.com/http}.
     * @param scope The scoping transaction name, or null for an unscoped (rollup) metric.
     * @param durationNanos The measured duration.
     */
    void recordMetric(String name, @Nullable String scope, long durationNanos);

}
