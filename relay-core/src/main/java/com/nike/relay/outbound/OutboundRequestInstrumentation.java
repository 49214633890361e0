package com.nike.relay.outbound;

import com.nike.relay.MetricNames;
import com.nike.relay.Segment;
import com.nike.relay.Tracer;
import com.nike.relay.Transaction;
import com.nike.relay.Transaction.HeaderMode;
import com.nike.relay.cat.CrossApplicationTracing;
import com.nike.relay.config.TracerConfig;
import com.nike.relay.http.UrlUtils;
import com.nike.relay.metrics.ExternalRecorder;
import com.nike.relay.util.TracingState;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.nike.relay.TraceHeaders.NEWRELIC_SYNTHETICS;
import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * Instruments outbound HTTP calls: creates the {@code External/<host>} segment under the ambient segment, attaches the
 * trace headers for the transaction's header family, and hands the executor a copy of the request carrying those
 * headers along with an {@link OutboundCall} for reporting the response.
 *
 * <p>Usage from a client adapter:
 * <pre>
 *      ClientRequest clientRequest = OutboundRequestInstrumentation.instrumentOutbound(
 *          request,
 *          (tracedRequest, call) -&gt; {
 *              ClientRequest req = client.send(tracedRequest);
 *              req.onResponse(response -&gt; call.responseReceived(adapt(response)));
 *              req.onEnd(call.bind(call::responseEnded));
 *              req.onError(error -&gt; call.errorOccurred(error, req.hasErrorListeners()));
 *              return req;
 *          }
 *      );
 * </pre>
 *
 * <p>Header selection, per transaction and exclusive for its lifetime:
 * <ul>
 *     <li>distributed tracing enabled: B3 headers, unless the request opts out;</li>
 *     <li>otherwise cross application tracing enabled and an encoding key configured: the legacy CAT headers;</li>
 *     <li>otherwise none.</li>
 * </ul>
 * The synthetics header is forwarded whenever an encoding key is configured.
 */
@SuppressWarnings("WeakerAccess")
public class OutboundRequestInstrumentation {

    private static final Logger logger = LoggerFactory.getLogger(OutboundRequestInstrumentation.class);

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_HTTP_PORT = 80;
    public static final int DEFAULT_HTTPS_PORT = 443;
    public static final String HTTP_PROTOCOL = "http:";
    public static final String LIBRARY_NAME = "http";

    public static final String URL_ATTRIBUTE = "url";
    public static final String PROCEDURE_ATTRIBUTE = "procedure";
    public static final String REQUEST_PARAMETERS_ATTRIBUTE_PREFIX = "request.parameters.";

    private OutboundRequestInstrumentation() {
        // Nothing to do
    }

    /**
     * Runs {@code executor} for the given request, observed by an external segment when there is an active
     * transaction. The executor runs synchronously, with the external segment ambient; exceptions it throws end the
     * segment and propagate unchanged.
     *
     * @return Whatever the executor returns.
     */
    public static <R, E extends Throwable> R instrumentOutbound(OutboundRequest request,
                                                                 OutboundRequestExecutor<R, E> executor) throws E {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }

        Tracer tracer = Tracer.getInstance();
        TracerConfig config = tracer.getConfig();

        String hostname = resolveHostname(request);
        int port = resolvePort(request);
        if (StringUtils.isBlank(hostname) || port < 1) {
            logger.warn("Invalid host name ({}) or port ({}) for outbound request. The call will not be traced.",
                        hostname, port);
            return executor.execute(request, OutboundCall.NOOP);
        }

        if (port != DEFAULT_HTTP_PORT) {
            hostname = hostname + ":" + port;
        }

        Segment parent = tracer.getSegment();
        if (parent != null && parent.isRecording() && parent.isCaptureSuppressed()) {
            logger.trace("Not capturing data for outbound request because parent segment is opaque. parent={}",
                         parent.getName());
            return executor.execute(request, OutboundCall.NOOP);
        }

        Transaction transaction = (parent == null) ? null : parent.getTransaction();
        if (transaction == null || transaction.isEnded()) {
            logger.trace("No active transaction, outbound request will not be traced. hostname={}", hostname);
            return executor.execute(request, OutboundCall.NOOP);
        }

        Segment segment = tracer.startSegment(
            parent, MetricNames.EXTERNAL_PREFIX + hostname, false, new ExternalRecorder(hostname, LIBRARY_NAME)
        );

        OutboundRequest tracedRequest = request.withAddedHeaders(buildTraceHeaders(config, transaction, segment,
                                                                                   request));

        UrlUtils.ParsedUrl parsed = UrlUtils.scrubAndParseParameters(request.getPath());
        segment.appendName(parsed.getPath());
        if (segment.canCaptureAttributes()) {
            for (Map.Entry<String, Object> parameter : parsed.getParameters().entrySet()) {
                segment.addSpanAttribute(REQUEST_PARAMETERS_ATTRIBUTE_PREFIX + parameter.getKey(),
                                         parameter.getValue());
            }

            String protocol = (request.getProtocol() == null) ? HTTP_PROTOCOL : request.getProtocol();
            segment.addAttribute(URL_ATTRIBUTE, protocol + "//" + hostname + parsed.getPath());
            segment.addAttribute(PROCEDURE_ATTRIBUTE,
                                 StringUtils.isBlank(request.getMethod()) ? "GET" : request.getMethod());
        }

        OutboundCall call = new SegmentOutboundCall(segment, hostname, config);

        TracingState originalThreadInfo = null;
        boolean issued = false;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segment, MDC.getCopyOfContextMap());

            R result = executor.execute(tracedRequest, call);
            issued = true;
            return result;
        }
        finally {
            if (!issued) {
                segment.end();
            }
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }

    /**
     * @return The trace headers to add to an outbound call made from {@code segment}. Commits the transaction to a
     * header family the first time headers are added.
     */
    protected static Map<String, String> buildTraceHeaders(TracerConfig config,
                                                           Transaction transaction,
                                                           Segment segment,
                                                           OutboundRequest request) {
        Map<String, String> outboundHeaders = new LinkedHashMap<>();

        boolean hasEncodingKey = !StringUtils.isBlank(config.getEncodingKey());
        if (hasEncodingKey && transaction.getSyntheticsHeader() != null) {
            outboundHeaders.put(NEWRELIC_SYNTHETICS, transaction.getSyntheticsHeader());
        }

        if (config.isDistributedTracingEnabled()) {
            if (request.isDistributedTracingDisabled()) {
                logger.trace("Distributed tracing disabled by instrumentation for this request.");
            }
            else if (transaction.claimHeaderMode(HeaderMode.DISTRIBUTED_TRACING) == HeaderMode.DISTRIBUTED_TRACING) {
                transaction.insertDistributedTraceHeaders(segment, outboundHeaders);
            }
            else {
                logger.trace("Transaction already sends cross application tracing headers, not adding distributed "
                             + "trace headers. transaction_id={}", transaction.getTransactionId());
            }
        }
        else if (config.isCrossApplicationTracerEnabled()) {
            if (!hasEncodingKey) {
                logger.trace("No encoding key found - not adding request CAT headers");
            }
            else if (transaction.claimHeaderMode(HeaderMode.CROSS_APPLICATION_TRACING)
                     == HeaderMode.CROSS_APPLICATION_TRACING) {
                CrossApplicationTracing.addCatHeaders(config, transaction, outboundHeaders);
            }
            else {
                logger.trace("Transaction already sends distributed trace headers, not adding CAT headers. "
                             + "transaction_id={}", transaction.getTransactionId());
            }
        }
        else {
            logger.trace("Both DT and CAT are disabled, not adding headers!");
        }

        return outboundHeaders;
    }

    /**
     * @return The hostname, else the host, else {@value #DEFAULT_HOST}.
     */
    protected static String resolveHostname(OutboundRequest request) {
        if (request.getHostname() != null) {
            return request.getHostname();
        }

        if (request.getHost() != null) {
            return request.getHost();
        }

        return DEFAULT_HOST;
    }

    /**
     * @return The port, else the default port, else 80 for plain HTTP and 443 for anything else. A port of 0 counts as
     * unset.
     */
    protected static int resolvePort(OutboundRequest request) {
        if (isSetPort(request.getPort())) {
            return request.getPort();
        }

        if (isSetPort(request.getDefaultPort())) {
            return request.getDefaultPort();
        }

        String protocol = request.getProtocol();
        return (protocol == null || HTTP_PROTOCOL.equalsIgnoreCase(protocol)) ? DEFAULT_HTTP_PORT : DEFAULT_HTTPS_PORT;
    }

    private static boolean isSetPort(Integer port) {
        return port != null && port != 0;
    }
}
