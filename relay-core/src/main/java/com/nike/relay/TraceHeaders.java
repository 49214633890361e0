package com.nike.relay;

/**
 * Headers that are used to pass tracing information across process boundaries. The B3 headers carry the modern
 * distributed trace context, the {@code x-newrelic-*} headers carry the legacy cross-application tracing payloads.
 * A transaction only ever sends one of the two families.
 *
 * @author Robert Roeser
 */
public interface TraceHeaders {

    /**
     * The root id of the distributed trace, 16 lowercase hex characters.
     */
    String TRACE_ID = "X-B3-TraceId";

    /**
     * The id of the segment making the outbound call.
     */
    String SPAN_ID = "X-B3-SpanId";

    /**
     * The id of the parent of the segment making the outbound call. Only sent when there is a parent.
     */
    String PARENT_SPAN_ID = "X-B3-ParentSpanId";

    /**
     * Always "1" when sent by this library since sampling decisions are made elsewhere.
     */
    String TRACE_SAMPLED = "X-B3-Sampled";

    /**
     * Legacy: the obfuscated cross process id of the calling application.
     */
    String NEWRELIC_ID = "x-newrelic-id";

    /**
     * Legacy: the obfuscated {@code [transactionId, false, tripId, pathHash]} payload.
     */
    String NEWRELIC_TRANSACTION = "x-newrelic-transaction";

    /**
     * Legacy: synthetics monitor payload, forwarded as received.
     */
    String NEWRELIC_SYNTHETICS = "x-newrelic-synthetics";

    /**
     * Legacy response header: the obfuscated app data identifying the callee.
     */
    String NEWRELIC_APP_DATA = "x-newrelic-app-data";

}
