package com.nike.relay.metrics;

import com.nike.relay.Segment;

/**
 * Turns one finished segment into metric measurements. Attached to a segment when it is started and run by
 * {@link com.nike.relay.Tracer#completeTransaction(com.nike.relay.Transaction)} once the segment's names are final.
 */
public interface SegmentRecorder {

    /**
     * @param segment The ended segment to record.
     * @param scope The owning transaction's final name.
     * @param sink Where the measurements go.
     */
    void record(Segment segment, String scope, MetricSink sink);

}
