package com.nike.relay.metrics;

/**
 * Default {@link MetricSink}: drops every measurement.
 */
public class NoOpMetricSink implements MetricSink {

    private static final NoOpMetricSink DEFAULT_INSTANCE = new NoOpMetricSink();

    public static NoOpMetricSink getDefaultInstance() {
        return DEFAULT_INSTANCE;
    }

    @Override
    public void recordMetric(String name, String scope, long durationNanos) {
        // Do nothing.
    }
}
