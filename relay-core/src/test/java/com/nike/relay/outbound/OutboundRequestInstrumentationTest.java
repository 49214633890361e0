package com.nike.relay.outbound;

import com.nike.relay.Segment;
import com.nike.relay.TraceHeaders;
import com.nike.relay.Tracer;
import com.nike.relay.Transaction;
import com.nike.relay.Transaction.HeaderMode;
import com.nike.relay.cat.Obfuscator;
import com.nike.relay.config.TracerConfig;
import com.nike.relay.http.ResponseWithHeaders;
import com.nike.relay.metrics.ExternalRecorder;
import com.nike.relay.metrics.NoOpMetricSink;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

/**
 * Tests the functionality of {@link OutboundRequestInstrumentation} and of the {@link OutboundCall} it hands to
 * executors.
 */
@RunWith(DataProviderRunner.class)
public class OutboundRequestInstrumentationTest {

    private static final String ENCODING_KEY = "secret";

    private List<OutboundRequest> executedRequests;
    private List<OutboundCall> executedCalls;
    private List<Segment> ambientSegmentsDuringExecution;

    private OutboundRequestExecutor<OutboundCall, RuntimeException> capturingExecutor;

    @Before
    public void beforeMethod() {
        resetTracer();
        executedRequests = new ArrayList<>();
        executedCalls = new ArrayList<>();
        ambientSegmentsDuringExecution = new ArrayList<>();
        capturingExecutor = (request, call) -> {
            executedRequests.add(request);
            executedCalls.add(call);
            ambientSegmentsDuringExecution.add(Tracer.getInstance().getSegment());
            return call;
        };
    }

    @After
    public void afterMethod() {
        resetTracer();
    }

    private void resetTracer() {
        Tracer.getInstance().unregisterFromThread();
        MDC.clear();
        Tracer.getInstance().setConfig(TracerConfig.newBuilder().build());
        Tracer.getInstance().setMetricSink(NoOpMetricSink.getDefaultInstance());
        Tracer.getInstance().removeAllSegmentLifecycleListeners();
        Tracer.getInstance().getSegmentTermsNormalizer().clear();
    }

    private OutboundRequest.Builder exampleRequest() {
        return OutboundRequest.newBuilder()
                              .withHostname("example.com")
                              .withMethod("GET")
                              .withPath("/orders?id=5&verbose");
    }

    private TracerConfig distributedTracingConfig() {
        return TracerConfig.newBuilder()
                           .withDistributedTracingEnabled(true)
                           .withEncodingKey(ENCODING_KEY)
                           .build();
    }

    private TracerConfig catConfig() {
        return TracerConfig.newBuilder()
                           .withApplicationNames(Collections.singletonList("app"))
                           .withCrossApplicationTracerEnabled(true)
                           .withEncodingKey(ENCODING_KEY)
                           .withCrossProcessId("190#42")
                           .withTrustedAccountIds(Collections.singletonList(190L))
                           .build();
    }

    private ResponseWithHeaders response(int statusCode, String statusText, String appData) {
        ResponseWithHeaders response = mock(ResponseWithHeaders.class);
        doReturn(statusCode).when(response).getStatusCode();
        doReturn(statusText).when(response).getStatusText();
        doReturn(appData).when(response).getHeader(TraceHeaders.NEWRELIC_APP_DATA);
        return response;
    }

    @Test
    public void instrumentOutbound_throws_IllegalArgumentException_for_null_arguments() {
        // expect
        assertThat(catchThrowable(() -> OutboundRequestInstrumentation.instrumentOutbound(null, capturingExecutor)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> OutboundRequestInstrumentation.instrumentOutbound(
            exampleRequest().build(), (OutboundRequestExecutor<Object, RuntimeException>) null
        ))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void instrumentOutbound_runs_the_original_request_untraced_when_there_is_no_transaction() {
        // given
        OutboundRequest request = exampleRequest().build();

        // when
        OutboundCall result = OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor);

        // then
        assertThat(result).isSameAs(OutboundCall.NOOP);
        assertThat(executedRequests).containsExactly(request);
        assertThat(result.getSegment()).isNull();
    }

    @Test
    public void instrumentOutbound_creates_an_external_segment_and_adds_distributed_trace_headers() {
        // given
        Tracer.getInstance().setConfig(distributedTracingConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundRequest request = exampleRequest().build();

        // when
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor);

        // then
        Segment segment = call.getSegment();
        assertThat(segment).isNotNull();
        assertThat(segment.getName()).isEqualTo("External/example.com/orders");
        assertThat(segment.getParent()).isSameAs(tx.getRootSegment());
        assertThat(segment.getRecorder()).isInstanceOf(ExternalRecorder.class);
        assertThat(((ExternalRecorder) segment.getRecorder()).getHost()).isEqualTo("example.com");
        assertThat(segment.isEnded()).isFalse();

        OutboundRequest sent = executedRequests.get(0);
        assertThat(sent).isNotSameAs(request);
        assertThat(sent.getHeader(TraceHeaders.TRACE_ID)).isEqualTo(tx.getTraceId());
        assertThat(sent.getHeader(TraceHeaders.SPAN_ID)).isEqualTo(segment.getSegmentId());
        assertThat(sent.getHeader(TraceHeaders.PARENT_SPAN_ID)).isEqualTo(tx.getRootSegment().getSegmentId());
        assertThat(sent.getHeader(TraceHeaders.TRACE_SAMPLED)).isEqualTo("1");
        assertThat(sent.getHeader(TraceHeaders.NEWRELIC_ID)).isNull();
        assertThat(request.getHeaders()).isEmpty();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.DISTRIBUTED_TRACING);

        assertThat(ambientSegmentsDuringExecution).containsExactly(segment);
        assertThat(Tracer.getInstance().getSegment()).isSameAs(tx.getRootSegment());
    }

    @Test
    public void instrumentOutbound_records_url_procedure_and_request_parameters() {
        // given
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);

        // when
        Segment segment = OutboundRequestInstrumentation.instrumentOutbound(
            exampleRequest().withProtocol("http:").withMethod(null).build(), capturingExecutor
        ).getSegment();

        // then
        assertThat(segment.getAttributes())
            .containsEntry(OutboundRequestInstrumentation.URL_ATTRIBUTE, "http://example.com/orders")
            .containsEntry(OutboundRequestInstrumentation.PROCEDURE_ATTRIBUTE, "GET");
        assertThat(segment.getSpanAttributes())
            .containsEntry("request.parameters.id", "5")
            .containsEntry("request.parameters.verbose", Boolean.TRUE);
    }

    @DataProvider(value = {
        "http:      |   null    |   null    |   example.com",
        "http:      |   8080    |   null    |   example.com:8080",
        "https:     |   null    |   null    |   example.com:443",
        "https:     |   null    |   8443    |   example.com:8443",
        "null       |   80      |   null    |   example.com",
        "https:     |   80      |   null    |   example.com",
        "http:      |   0       |   null    |   example.com",
        "https:     |   0       |   8443    |   example.com:8443",
        "https:     |   0       |   0       |   example.com:443"
    }, splitBy = "\\|")
    @Test
    public void instrumentOutbound_appends_the_port_to_the_host_unless_it_is_80(
        String protocol, Integer port, Integer defaultPort, String expectedHost
    ) {
        // given
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundRequest request = OutboundRequest.newBuilder()
                                                 .withProtocol(protocol)
                                                 .withHostname("example.com")
                                                 .withPort(port)
                                                 .withDefaultPort(defaultPort)
                                                 .withPath("/")
                                                 .build();

        // when
        Segment segment = OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor).getSegment();

        // then
        assertThat(segment.getName()).isEqualTo("External/" + expectedHost + "/");
    }

    @Test
    public void resolveHostname_prefers_hostname_then_host_then_localhost() {
        // expect
        assertThat(OutboundRequestInstrumentation.resolveHostname(
            OutboundRequest.newBuilder().withHostname("a").withHost("b").build()
        )).isEqualTo("a");
        assertThat(OutboundRequestInstrumentation.resolveHostname(
            OutboundRequest.newBuilder().withHost("b").build()
        )).isEqualTo("b");
        assertThat(OutboundRequestInstrumentation.resolveHostname(
            OutboundRequest.newBuilder().build()
        )).isEqualTo(OutboundRequestInstrumentation.DEFAULT_HOST);
    }

    @DataProvider(value = {
        "   |   80",
        "example.com    |   -1"
    }, splitBy = "\\|")
    @Test
    public void instrumentOutbound_does_not_trace_calls_with_invalid_host_or_port(String hostname, int port) {
        // given
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundRequest request = OutboundRequest.newBuilder().withHostname(hostname).withPort(port).build();

        // when
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor);

        // then
        assertThat(call).isSameAs(OutboundCall.NOOP);
        assertThat(executedRequests).containsExactly(request);
        assertThat(tx.getRootSegment().getChildren()).isEmpty();
    }

    @Test
    public void instrumentOutbound_skips_calls_whose_ambient_segment_is_opaque() {
        // given
        Tracer.getInstance().setConfig(distributedTracingConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        Segment opaque = Tracer.getInstance().startSegment(null, "Datastore/opaqueClient", true, null);
        Tracer.getInstance().registerWithThread(opaque);
        OutboundRequest request = exampleRequest().build();

        // when
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor);

        // then
        assertThat(call).isSameAs(OutboundCall.NOOP);
        assertThat(executedRequests).containsExactly(request);
        assertThat(executedRequests.get(0).getHeaders()).isEmpty();
        assertThat(opaque.getChildren()).isEmpty();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.NONE);
    }

    @Test
    public void instrumentOutbound_adds_cat_headers_when_distributed_tracing_is_disabled() throws Exception {
        // given
        Tracer.getInstance().setConfig(catConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);

        // when
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // then
        OutboundRequest sent = executedRequests.get(0);
        assertThat(sent.getHeader(TraceHeaders.NEWRELIC_ID)).isEqualTo("QlxTUVFG");
        assertThat(Obfuscator.deobfuscate(sent.getHeader(TraceHeaders.NEWRELIC_TRANSACTION), ENCODING_KEY))
            .isEqualTo("[\"" + tx.getTransactionId() + "\",false,\"" + tx.getTripId() + "\",\"e40b02aa\"]");
        assertThat(sent.getHeader(TraceHeaders.TRACE_ID)).isNull();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.CROSS_APPLICATION_TRACING);
    }

    @Test
    public void instrumentOutbound_adds_no_cat_headers_without_an_encoding_key() {
        // given
        Tracer.getInstance().setConfig(catConfig().toBuilder().withEncodingKey(null).build());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);

        // when
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // then
        assertThat(executedRequests.get(0).getHeaders()).isEmpty();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.NONE);
    }

    @Test
    public void a_transaction_never_switches_header_families() {
        // given
        Tracer.getInstance().setConfig(catConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // when
        Tracer.getInstance().setConfig(catConfig().toBuilder().withDistributedTracingEnabled(true).build());
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // then
        OutboundRequest second = executedRequests.get(1);
        assertThat(second.getHeader(TraceHeaders.TRACE_ID)).isNull();
        assertThat(second.getHeader(TraceHeaders.NEWRELIC_TRANSACTION)).isNull();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.CROSS_APPLICATION_TRACING);
    }

    @Test
    public void distributed_tracing_takes_precedence_over_cat_when_both_are_enabled() {
        // given
        Tracer.getInstance().setConfig(catConfig().toBuilder().withDistributedTracingEnabled(true).build());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);

        // when
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // then
        OutboundRequest sent = executedRequests.get(0);
        assertThat(sent.getHeader(TraceHeaders.TRACE_ID)).isEqualTo(tx.getTraceId());
        assertThat(sent.getHeader(TraceHeaders.NEWRELIC_ID)).isNull();
        assertThat(sent.getHeader(TraceHeaders.NEWRELIC_TRANSACTION)).isNull();
    }

    @Test
    public void a_request_can_opt_out_of_distributed_trace_headers() {
        // given
        Tracer.getInstance().setConfig(distributedTracingConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);

        // when
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(
            exampleRequest().withDistributedTracingDisabled(true).build(), capturingExecutor
        );

        // then
        assertThat(call.getSegment()).isNotNull();
        assertThat(executedRequests.get(0).getHeader(TraceHeaders.TRACE_ID)).isNull();
        assertThat(tx.getHeaderMode()).isEqualTo(HeaderMode.NONE);
    }

    @Test
    public void the_synthetics_header_is_forwarded_when_an_encoding_key_is_configured() {
        // given
        Tracer.getInstance().setConfig(catConfig());
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        tx.setSyntheticsHeader("syntheticsPayload");

        // when
        OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(), capturingExecutor);

        // then
        assertThat(executedRequests.get(0).getHeader(TraceHeaders.NEWRELIC_SYNTHETICS))
            .isEqualTo("syntheticsPayload");
    }

    @Test
    public void existing_header_values_are_replaced_for_the_map_shape() {
        // given
        Tracer.getInstance().setConfig(distributedTracingConfig());
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundRequest request = exampleRequest()
            .withHeaderMap(Collections.singletonMap(TraceHeaders.TRACE_ID, "stale"))
            .build();

        // when
        OutboundRequestInstrumentation.instrumentOutbound(request, capturingExecutor);

        // then
        assertThat(executedRequests.get(0).getHeadersAsMap().get(TraceHeaders.TRACE_ID)).isNotEqualTo("stale");
        assertThat(request.getHeader(TraceHeaders.TRACE_ID)).isEqualTo("stale");
    }

    @Test
    public void instrumentOutbound_ends_the_segment_and_rethrows_when_the_executor_throws() {
        // given
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        IOException connectFailure = new IOException("connection refused");
        AtomicReference<Segment> segmentSeen = new AtomicReference<>();

        // when
        Throwable ex = catchThrowable(() -> OutboundRequestInstrumentation.instrumentOutbound(
            exampleRequest().build(),
            (OutboundRequestExecutor<Object, IOException>) (request, call) -> {
                segmentSeen.set(call.getSegment());
                throw connectFailure;
            }
        ));

        // then
        assertThat(ex).isSameAs(connectFailure);
        assertThat(segmentSeen.get().isEnded()).isTrue();
        assertThat(Tracer.getInstance().getSegment()).isSameAs(tx.getRootSegment());
    }

    @Test
    public void responseReceived_records_status_span_attributes() {
        // given
        Tracer.getInstance().setConfig(distributedTracingConfig());
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(),
                                                                             capturingExecutor);

        // when
        call.responseReceived(response(404, "Not Found", null));
        call.responseEnded();

        // then
        Segment segment = call.getSegment();
        assertThat(segment.getSpanAttributes())
            .containsEntry(SegmentOutboundCall.HTTP_STATUS_CODE_ATTRIBUTE, 404)
            .containsEntry(SegmentOutboundCall.HTTP_STATUS_TEXT_ATTRIBUTE, "Not Found");
        assertThat(segment.isEnded()).isTrue();
    }

    @Test
    public void responseReceived_links_the_segment_to_a_trusted_cat_callee() {
        // given
        Tracer.getInstance().setConfig(catConfig());
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(),
                                                                             capturingExecutor);
        String appData = Obfuscator.obfuscate("[\"190#1\",\"WebTransaction/Uri/remote\"]", ENCODING_KEY);

        // when
        call.responseReceived(response(200, "OK", appData));

        // then
        Segment segment = call.getSegment();
        assertThat(segment.getCatId()).isEqualTo("190#1");
        assertThat(segment.getName()).isEqualTo("ExternalTransaction/example.com/190#1/WebTransaction/Uri/remote");
    }

    @Test
    public void responseReceived_ignores_cat_app_data_when_distributed_tracing_is_enabled() {
        // given
        Tracer.getInstance().setConfig(catConfig().toBuilder().withDistributedTracingEnabled(true).build());
        Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(),
                                                                             capturingExecutor);
        String appData = Obfuscator.obfuscate("[\"190#1\",\"WebTransaction/Uri/remote\"]", ENCODING_KEY);

        // when
        call.responseReceived(response(200, "OK", appData));

        // then
        assertThat(call.getSegment().getCatId()).isNull();
        assertThat(call.getSegment().getName()).isEqualTo("External/example.com/orders");
    }

    @DataProvider(value = {
        "true",
        "false"
    })
    @Test
    public void errorOccurred_ends_the_segment_and_notices_unhandled_errors(boolean handledByCaller) {
        // given
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(),
                                                                             capturingExecutor);
        RuntimeException error = new RuntimeException("socket hang up");

        // when
        call.errorOccurred(error, handledByCaller);

        // then
        assertThat(call.getSegment().isEnded()).isTrue();
        if (handledByCaller)
            assertThat(tx.getErrors()).isEmpty();
        else
            assertThat(tx.getErrors()).containsExactly(error);
    }

    @Test
    public void bind_runs_callbacks_with_the_external_segment_ambient() throws Exception {
        // given
        Transaction tx = Tracer.getInstance().startTransaction("WebTransaction/Uri/foo", Transaction.Type.WEB);
        OutboundCall call = OutboundRequestInstrumentation.instrumentOutbound(exampleRequest().build(),
                                                                             capturingExecutor);
        List<Segment> seen = new ArrayList<>();
        Runnable boundRunnable = call.bind(() -> {
            seen.add(Tracer.getInstance().getSegment());
        });
        Callable<Segment> boundCallable = call.bind(() -> Tracer.getInstance().getSegment());

        // when
        boundRunnable.run();
        Segment fromCallable = boundCallable.call();

        // then
        assertThat(seen).containsExactly(call.getSegment());
        assertThat(fromCallable).isSameAs(call.getSegment());
        assertThat(Tracer.getInstance().getSegment()).isSameAs(tx.getRootSegment());
    }

    @Test
    public void noop_call_runs_bound_callbacks_unchanged() throws Exception {
        // given
        List<String> calls = new ArrayList<>();

        // when
        OutboundCall.NOOP.responseReceived(response(200, "OK", null));
        OutboundCall.NOOP.responseEnded();
        OutboundCall.NOOP.errorOccurred(new RuntimeException("ignored"), false);
        OutboundCall.NOOP.bind(() -> {
            calls.add("runnable");
        }).run();
        String callableResult = OutboundCall.NOOP.bind(() -> "callable").call();

        // then
        assertThat(calls).containsExactly("runnable");
        assertThat(callableResult).isEqualTo("callable");
        assertThat(OutboundCall.NOOP.getSegment()).isNull();
    }
}
