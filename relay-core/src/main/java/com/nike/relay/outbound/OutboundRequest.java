package com.nike.relay.outbound;

import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of an outbound HTTP call, as seen by {@link OutboundRequestInstrumentation}.
 *
 * <p>Headers come in one of two shapes, matching what HTTP clients accept:
 * <ul>
 *     <li>{@link HeaderShape#MAP} - a key to value mapping. Keys are unique.</li>
 *     <li>{@link HeaderShape#PAIRS} - an ordered list of name/value pairs. Names may repeat.</li>
 * </ul>
 * Trace headers are never written into the caller's containers: {@link #withAddedHeaders(Map)} returns a copy.
 */
@SuppressWarnings("WeakerAccess")
public class OutboundRequest {

    /**
     * The header container shape the HTTP client uses.
     */
    public enum HeaderShape {
        MAP,
        PAIRS
    }

    private final String protocol;
    private final String hostname;
    private final String host;
    private final Integer port;
    private final Integer defaultPort;
    private final String method;
    private final String path;
    private final HeaderShape headerShape;
    private final List<Pair<String, String>> headers;
    private final boolean distributedTracingDisabled;

    private OutboundRequest(Builder builder) {
        this.protocol = builder.protocol;
        this.hostname = builder.hostname;
        this.host = builder.host;
        this.port = builder.port;
        this.defaultPort = builder.defaultPort;
        this.method = builder.method;
        this.path = builder.path;
        this.headerShape = builder.headerShape;
        this.headers = Collections.unmodifiableList(new ArrayList<>(builder.headers));
        this.distributedTracingDisabled = builder.distributedTracingDisabled;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return A builder initialized with this request's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.protocol = protocol;
        builder.hostname = hostname;
        builder.host = host;
        builder.port = port;
        builder.defaultPort = defaultPort;
        builder.method = method;
        builder.path = path;
        builder.headerShape = headerShape;
        builder.headers.addAll(headers);
        builder.distributedTracingDisabled = distributedTracingDisabled;
        return builder;
    }

    /**
     * @return The protocol including the trailing colon (e.g. {@code https:}), or null.
     */
    public @Nullable String getProtocol() {
        return protocol;
    }

    public @Nullable String getHostname() {
        return hostname;
    }

    /**
     * @return The host, used when no {@link #getHostname() hostname} is given.
     */
    public @Nullable String getHost() {
        return host;
    }

    public @Nullable Integer getPort() {
        return port;
    }

    /**
     * @return The port the HTTP client uses when none is given, or null.
     */
    public @Nullable Integer getDefaultPort() {
        return defaultPort;
    }

    public @Nullable String getMethod() {
        return method;
    }

    /**
     * @return The request path, possibly with a query string.
     */
    public @Nullable String getPath() {
        return path;
    }

    public @NotNull HeaderShape getHeaderShape() {
        return headerShape;
    }

    /**
     * @return The headers in order. For the {@link HeaderShape#MAP} shape the names are unique.
     */
    public @NotNull List<Pair<String, String>> getHeaders() {
        return headers;
    }

    /**
     * @return The headers as a map. For the {@link HeaderShape#PAIRS} shape the last value of a repeated name wins.
     */
    public @NotNull Map<String, String> getHeadersAsMap() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Pair<String, String> header : headers) {
            result.put(header.getLeft(), header.getRight());
        }

        return result;
    }

    /**
     * @return The value of the first header with the given name (case sensitive), or null.
     */
    public @Nullable String getHeader(String name) {
        for (Pair<String, String> header : headers) {
            if (header.getLeft().equals(name)) {
                return header.getRight();
            }
        }

        return null;
    }

    /**
     * @return true if the caller asked for no distributed trace headers on this particular request.
     */
    public boolean isDistributedTracingDisabled() {
        return distributedTracingDisabled;
    }

    /**
     * Merges the given headers into a copy of this request; this request is left untouched.
     *
     * <ul>
     *     <li>{@link HeaderShape#MAP}: a header whose name already exists replaces the value in place, other headers are
     *     appended.</li>
     *     <li>{@link HeaderShape#PAIRS}: every header is appended as a new pair.</li>
     * </ul>
     *
     * @return The merged copy, or this request when there is nothing to add.
     */
    public OutboundRequest withAddedHeaders(Map<String, String> headersToAdd) {
        if (headersToAdd == null || headersToAdd.isEmpty()) {
            return this;
        }

        List<Pair<String, String>> merged = new ArrayList<>(headers);
        for (Map.Entry<String, String> entry : headersToAdd.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }

            Pair<String, String> header = Pair.of(entry.getKey(), entry.getValue());
            if (headerShape == HeaderShape.MAP) {
                int existingIndex = indexOf(merged, entry.getKey());
                if (existingIndex >= 0) {
                    merged.set(existingIndex, header);
                    continue;
                }
            }

            merged.add(header);
        }

        Builder builder = toBuilder();
        builder.headers.clear();
        builder.headers.addAll(merged);
        return builder.build();
    }

    private static int indexOf(List<Pair<String, String>> headers, String name) {
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).getLeft().equals(name)) {
                return i;
            }
        }

        return -1;
    }

    @Override
    public String toString() {
        return "OutboundRequest{protocol='" + protocol + "', hostname='" + hostname + "', host='" + host
               + "', port=" + port + ", method='" + method + "', path='" + path + "', headerShape=" + headerShape
               + ", headers=" + headers.size() + "}";
    }

    /**
     * {@code OutboundRequest} builder static inner class.
     */
    public static final class Builder {
        private String protocol;
        private String hostname;
        private String host;
        private Integer port;
        private Integer defaultPort;
        private String method;
        private String path;
        private HeaderShape headerShape = HeaderShape.MAP;
        private final List<Pair<String, String>> headers = new ArrayList<>();
        private boolean distributedTracingDisabled;

        private Builder() {
        }

        public Builder withProtocol(String val) {
            protocol = val;
            return this;
        }

        public Builder withHostname(String val) {
            hostname = val;
            return this;
        }

        public Builder withHost(String val) {
            host = val;
            return this;
        }

        public Builder withPort(Integer val) {
            port = val;
            return this;
        }

        public Builder withDefaultPort(Integer val) {
            defaultPort = val;
            return this;
        }

        public Builder withMethod(String val) {
            method = val;
            return this;
        }

        public Builder withPath(String val) {
            path = val;
            return this;
        }

        /**
         * Uses the {@link HeaderShape#MAP} shape with a copy of the given headers.
         */
        public Builder withHeaderMap(Map<String, String> val) {
            headerShape = HeaderShape.MAP;
            headers.clear();
            if (val != null) {
                for (Map.Entry<String, String> entry : val.entrySet()) {
                    if (entry.getKey() == null) {
                        throw new IllegalArgumentException("Header names cannot be null");
                    }
                    headers.add(Pair.of(entry.getKey(), entry.getValue()));
                }
            }
            return this;
        }

        /**
         * Uses the {@link HeaderShape#PAIRS} shape with a copy of the given pairs.
         */
        public Builder withHeaderPairs(List<Pair<String, String>> val) {
            headerShape = HeaderShape.PAIRS;
            headers.clear();
            if (val != null) {
                for (Pair<String, String> pair : val) {
                    if (pair == null || pair.getLeft() == null) {
                        throw new IllegalArgumentException("Header pairs must have a non-null name");
                    }
                    headers.add(pair);
                }
            }
            return this;
        }

        public Builder withDistributedTracingDisabled(boolean val) {
            distributedTracingDisabled = val;
            return this;
        }

        public OutboundRequest build() {
            return new OutboundRequest(this);
        }
    }
}
