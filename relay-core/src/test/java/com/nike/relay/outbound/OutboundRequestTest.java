package com.nike.relay.outbound;

import com.nike.relay.outbound.OutboundRequest.HeaderShape;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Tests the functionality of {@link OutboundRequest}.
 */
public class OutboundRequestTest {

    @Test
    public void builder_copies_all_fields_and_toBuilder_round_trips_them() {
        // given
        OutboundRequest request = OutboundRequest.newBuilder()
                                                 .withProtocol("https:")
                                                 .withHostname("example.com")
                                                 .withHost("example.com:8443")
                                                 .withPort(8443)
                                                 .withDefaultPort(443)
                                                 .withMethod("POST")
                                                 .withPath("/orders?id=1")
                                                 .withHeaderMap(Collections.singletonMap("accept", "*/*"))
                                                 .withDistributedTracingDisabled(true)
                                                 .build();

        // when
        OutboundRequest copy = request.toBuilder().build();

        // then
        for (OutboundRequest r : Arrays.asList(request, copy)) {
            assertThat(r.getProtocol()).isEqualTo("https:");
            assertThat(r.getHostname()).isEqualTo("example.com");
            assertThat(r.getHost()).isEqualTo("example.com:8443");
            assertThat(r.getPort()).isEqualTo(8443);
            assertThat(r.getDefaultPort()).isEqualTo(443);
            assertThat(r.getMethod()).isEqualTo("POST");
            assertThat(r.getPath()).isEqualTo("/orders?id=1");
            assertThat(r.getHeaderShape()).isEqualTo(HeaderShape.MAP);
            assertThat(r.getHeader("accept")).isEqualTo("*/*");
            assertThat(r.isDistributedTracingDisabled()).isTrue();
        }
    }

    @Test
    public void default_shape_is_map_with_no_headers() {
        // when
        OutboundRequest request = OutboundRequest.newBuilder().build();

        // then
        assertThat(request.getHeaderShape()).isEqualTo(HeaderShape.MAP);
        assertThat(request.getHeaders()).isEmpty();
        assertThat(request.getHeader("foo")).isNull();
    }

    @Test
    public void withAddedHeaders_on_the_map_shape_replaces_in_place_and_appends_without_touching_the_caller_map() {
        // given
        Map<String, String> callerHeaders = new LinkedHashMap<>();
        callerHeaders.put("accept", "*/*");
        callerHeaders.put("X-B3-TraceId", "stale");
        Map<String, String> callerHeadersSnapshot = new LinkedHashMap<>(callerHeaders);
        OutboundRequest request = OutboundRequest.newBuilder().withHeaderMap(callerHeaders).build();

        Map<String, String> toAdd = new LinkedHashMap<>();
        toAdd.put("X-B3-TraceId", "fresh");
        toAdd.put("X-B3-SpanId", "span");

        // when
        OutboundRequest merged = request.withAddedHeaders(toAdd);

        // then
        assertThat(merged).isNotSameAs(request);
        assertThat(merged.getHeaders()).containsExactly(
            Pair.of("accept", "*/*"),
            Pair.of("X-B3-TraceId", "fresh"),
            Pair.of("X-B3-SpanId", "span")
        );
        assertThat(request.getHeaders()).containsExactly(
            Pair.of("accept", "*/*"),
            Pair.of("X-B3-TraceId", "stale")
        );
        assertThat(callerHeaders).isEqualTo(callerHeadersSnapshot);
    }

    @Test
    public void withAddedHeaders_on_the_pairs_shape_appends_without_touching_the_caller_list() {
        // given
        List<Pair<String, String>> callerPairs = new ArrayList<>();
        callerPairs.add(Pair.of("cookie", "a=1"));
        callerPairs.add(Pair.of("cookie", "b=2"));
        List<Pair<String, String>> callerPairsSnapshot = new ArrayList<>(callerPairs);
        OutboundRequest request = OutboundRequest.newBuilder().withHeaderPairs(callerPairs).build();

        Map<String, String> toAdd = new LinkedHashMap<>();
        toAdd.put("cookie", "c=3");
        toAdd.put("x-newrelic-id", "abc");

        // when
        OutboundRequest merged = request.withAddedHeaders(toAdd);

        // then
        assertThat(merged.getHeaderShape()).isEqualTo(HeaderShape.PAIRS);
        assertThat(merged.getHeaders()).containsExactly(
            Pair.of("cookie", "a=1"),
            Pair.of("cookie", "b=2"),
            Pair.of("cookie", "c=3"),
            Pair.of("x-newrelic-id", "abc")
        );
        assertThat(merged.getHeader("cookie")).isEqualTo("a=1");
        assertThat(merged.getHeadersAsMap()).containsEntry("cookie", "c=3");
        assertThat(request.getHeaders()).hasSize(2);
        assertThat(callerPairs).isEqualTo(callerPairsSnapshot);
    }

    @Test
    public void withAddedHeaders_returns_the_same_request_when_there_is_nothing_to_add() {
        // given
        OutboundRequest request = OutboundRequest.newBuilder().build();

        // expect
        assertThat(request.withAddedHeaders(null)).isSameAs(request);
        assertThat(request.withAddedHeaders(Collections.<String, String>emptyMap())).isSameAs(request);
    }

    @Test
    public void withAddedHeaders_skips_null_names() {
        // given
        OutboundRequest request = OutboundRequest.newBuilder().build();
        Map<String, String> toAdd = new LinkedHashMap<>();
        toAdd.put(null, "ignored");
        toAdd.put("kept", "value");

        // when
        OutboundRequest merged = request.withAddedHeaders(toAdd);

        // then
        assertThat(merged.getHeaders()).containsExactly(Pair.of("kept", "value"));
    }

    @Test
    public void builder_rejects_null_header_names() {
        // given
        Map<String, String> nullKeyMap = new LinkedHashMap<>();
        nullKeyMap.put(null, "value");

        // expect
        assertThat(catchThrowable(() -> OutboundRequest.newBuilder().withHeaderMap(nullKeyMap)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(
            () -> OutboundRequest.newBuilder().withHeaderPairs(Collections.<Pair<String, String>>singletonList(null))
        )).isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(
            () -> OutboundRequest.newBuilder().withHeaderPairs(
                Collections.singletonList(Pair.<String, String>of(null, "value"))
            )
        )).isInstanceOf(IllegalArgumentException.class);
    }
}
