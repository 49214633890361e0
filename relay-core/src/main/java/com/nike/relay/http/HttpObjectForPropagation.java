package com.nike.relay.http;

/**
 * Simple wrapper interface around any kind of outbound header carrier so that
 * {@link HttpRequestTracingUtils#propagateTracingHeaders(HttpObjectForPropagation, com.nike.relay.Segment)} can add
 * trace headers to it.
 */
public interface HttpObjectForPropagation {

    /**
     * Sets the given header. An existing header of the same name is replaced.
     */
    void setHeader(String headerKey, String headerValue);

}
