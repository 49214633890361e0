package com.nike.relay.http;

import com.nike.relay.Segment;
import com.nike.relay.TraceHeaders;
import com.nike.relay.Transaction;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.nike.relay.TraceHeaders.PARENT_SPAN_ID;
import static com.nike.relay.TraceHeaders.SPAN_ID;
import static com.nike.relay.TraceHeaders.TRACE_ID;
import static com.nike.relay.TraceHeaders.TRACE_SAMPLED;

/**
 * Reads and writes the modern (B3) distributed trace headers.
 *
 * @author Nic Munroe
 */
@SuppressWarnings("WeakerAccess")
public class HttpRequestTracingUtils {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestTracingUtils.class);

    private HttpRequestTracingUtils() {
        // Nothing to do
    }

    /**
     * @return The caller's trace id from the {@link TraceHeaders#TRACE_ID} header (or request attribute), or null if
     * the caller did not send one.
     */
    public static @Nullable String getTraceId(RequestWithHeaders request) {
        if (request == null) {
            return null;
        }

        String requestTraceId = getHeaderWithAttributeAsBackup(request, TRACE_ID);

        logger.debug("TraceId from client is TraceId={}", requestTraceId);

        return requestTraceId;
    }

    /**
     * @return The caller's span id from the {@link TraceHeaders#SPAN_ID} header (or request attribute), or null.
     */
    public static @Nullable String getSpanId(RequestWithHeaders request) {
        if (request == null) {
            return null;
        }

        return getHeaderWithAttributeAsBackup(request, SPAN_ID);
    }

    /**
     * @return The trimmed header value if non-blank, otherwise the trimmed {@code toString()} of the request attribute
     * with the same name, otherwise null.
     */
    public static @Nullable String getHeaderWithAttributeAsBackup(RequestWithHeaders request, String headerName) {
        Object result = request.getHeader(headerName);

        if (result == null || result.toString().trim().length() == 0) {
            result = request.getAttribute(headerName);
        }

        if (result == null || result.toString().trim().length() == 0) {
            return null;
        }

        return result.toString().trim();
    }

    /**
     * Sets the B3 headers identifying the given segment on the given carrier: the transaction's trace id, the
     * segment's id, the id of the segment's parent (or, for a root segment, of the remote caller) when there is one,
     * and a sampled flag of "1".
     */
    public static void propagateTracingHeaders(HttpObjectForPropagation httpObjectForPropagation, Segment segment) {
        if (segment == null || httpObjectForPropagation == null) {
            return;
        }

        Transaction transaction = segment.getTransaction();
        if (transaction == null) {
            return;
        }

        httpObjectForPropagation.setHeader(TRACE_ID, transaction.getTraceId());
        httpObjectForPropagation.setHeader(SPAN_ID, segment.getSegmentId());
        httpObjectForPropagation.setHeader(TRACE_SAMPLED, "1");

        String parentSpanId = (segment.getParent() == null)
                              ? transaction.getParentSpanId()
                              : segment.getParent().getSegmentId();
        if (parentSpanId != null) {
            httpObjectForPropagation.setHeader(PARENT_SPAN_ID, parentSpanId);
        }
    }
}
