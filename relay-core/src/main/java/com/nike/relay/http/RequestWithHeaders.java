package com.nike.relay.http;

/**
 * Simple wrapper interface around an inbound request so tracing can read headers without knowing which HTTP
 * framework is in use. Used when a transaction is started for an inbound request, to continue the caller's trace.
 */
public interface RequestWithHeaders {

    /**
     * @return The value of the given header, or null if the request does not have it.
     */
    String getHeader(String headerName);

    /**
     * @return The request attribute with the given name, or null. Checked when the header is missing, for frameworks
     * that move headers into request attributes.
     */
    Object getAttribute(String name);
}
