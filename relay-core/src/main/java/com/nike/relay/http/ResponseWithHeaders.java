package com.nike.relay.http;

/**
 * Read-only view of an outbound call's response, handed to
 * {@link com.nike.relay.outbound.OutboundCall#responseReceived(ResponseWithHeaders)} by the adapter for the HTTP client
 * in use.
 */
public interface ResponseWithHeaders {

    /**
     * @return The value of the given response header, or null if absent. Absence is never an error.
     */
    String getHeader(String headerName);

    /**
     * @return The HTTP status code, or null if unknown.
     */
    Integer getStatusCode();

    /**
     * @return The HTTP status text (reason phrase), or null if unknown.
     */
    String getStatusText();
}
