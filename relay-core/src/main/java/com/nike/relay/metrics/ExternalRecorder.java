package com.nike.relay.metrics;

import com.nike.relay.MetricNames;
import com.nike.relay.Segment;
import com.nike.relay.Transaction;

/**
 * Records the metrics for a segment that wraps a call to another process.
 *
 * <p>When the callee identified itself through a trusted cross-application response the segment carries the callee's
 * {@code catId} and {@code catTransaction}, and the call is recorded against the callee application. Otherwise it is
 * recorded against the host and client library. The host and overall rollups are recorded either way.
 */
public class ExternalRecorder implements SegmentRecorder {

    private final String host;
    private final String library;

    public ExternalRecorder(String host, String library) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }

        if (library == null) {
            throw new IllegalArgumentException("library cannot be null");
        }

        this.host = host;
        this.library = library;
    }

    public String getHost() {
        return host;
    }

    public String getLibrary() {
        return library;
    }

    @Override
    public void record(Segment segment, String scope, MetricSink sink) {
        Long duration = segment.getDurationNanos();
        if (duration == null) {
            return;
        }

        long durationNanos = duration;
        String hostLibrary = MetricNames.EXTERNAL_PREFIX + host + "/" + library;

        String catId = segment.getCatId();
        String catTransaction = segment.getCatTransaction();
        if (catId != null && catTransaction != null) {
            String transactionMetric =
                MetricNames.EXTERNAL_TRANSACTION + host + "/" + catId + "/" + catTransaction;

            sink.recordMetric(MetricNames.EXTERNAL_APP + host + "/" + catId + "/all", null, durationNanos);
            sink.recordMetric(transactionMetric, null, durationNanos);
            sink.recordMetric(transactionMetric, scope, durationNanos);
        }
        else {
            sink.recordMetric(hostLibrary, scope, durationNanos);
        }

        sink.recordMetric(hostLibrary, null, durationNanos);

        Transaction transaction = segment.getTransaction();
        boolean web = transaction != null && transaction.isWeb();
        sink.recordMetric(web ? MetricNames.EXTERNAL_ALL_WEB : MetricNames.EXTERNAL_ALL_OTHER, null, durationNanos);

        sink.recordMetric(MetricNames.EXTERNAL_PREFIX + host + "/all", null, durationNanos);
        sink.recordMetric(MetricNames.EXTERNAL_ALL, null, durationNanos);
    }

    @Override
    public String toString() {
        return "ExternalRecorder{host='" + host + "', library='" + library + "'}";
    }
}
