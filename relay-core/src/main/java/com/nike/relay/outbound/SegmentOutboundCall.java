package com.nike.relay.outbound;

import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.Transaction;
import com.nike.relay.cat.CrossApplicationTracing;
import com.nike.relay.config.TracerConfig;
import com.nike.relay.http.ResponseWithHeaders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

import static com.nike.relay.TraceHeaders.NEWRELIC_APP_DATA;

/**
 * {@link OutboundCall} for an observed call: reports onto the external segment created by
 * {@link OutboundRequestInstrumentation}.
 */
class SegmentOutboundCall implements OutboundCall {

    private static final Logger logger = LoggerFactory.getLogger(SegmentOutboundCall.class);

    static final String HTTP_STATUS_CODE_ATTRIBUTE = "http.statusCode";
    static final String HTTP_STATUS_TEXT_ATTRIBUTE = "http.statusText";

    private final Segment segment;
    private final String hostname;
    private final TracerConfig config;

    SegmentOutboundCall(Segment segment, String hostname, TracerConfig config) {
        this.segment = segment;
        this.hostname = hostname;
        this.config = config;
    }

    @Override
    public Segment getSegment() {
        return segment;
    }

    @Override
    public void responseReceived(ResponseWithHeaders response) {
        if (response == null) {
            return;
        }

        segment.addSpanAttribute(HTTP_STATUS_CODE_ATTRIBUTE, response.getStatusCode());
        segment.addSpanAttribute(HTTP_STATUS_TEXT_ATTRIBUTE, response.getStatusText());

        if (config.isCrossApplicationTracerEnabled() && !config.isDistributedTracingEnabled()) {
            CrossApplicationTracing.pullCatHeaders(config, segment, hostname, response.getHeader(NEWRELIC_APP_DATA));
        }
    }

    @Override
    public void responseEnded() {
        segment.end();
    }

    @Override
    public void errorOccurred(Throwable error, boolean handledByCaller) {
        segment.end();

        if (handledByCaller || error == null) {
            return;
        }

        Transaction transaction = segment.getTransaction();
        if (transaction != null) {
            logger.debug("Outbound call failed with no error handler, noticing the error. segment={}", segment);
            transaction.noticeError(error);
        }
    }

    @Override
    public Runnable bind(Runnable runnable) {
        return Tracer.getInstance().bindRunnable(runnable, segment);
    }

    @Override
    public <T> Callable<T> bind(Callable<T> callable) {
        return Tracer.getInstance().bindCallable(callable, segment);
    }

    @Override
    public String toString() {
        return "SegmentOutboundCall{segment=" + segment + ", hostname='" + hostname + "'}";
    }
}
