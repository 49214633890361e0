package com.nike.relay.outbound;

/**
 * Performs an outbound call on behalf of {@link OutboundRequestInstrumentation}. Implemented by the adapter for the
 * HTTP client in use.
 *
 * @param <R> What issuing the call returns (a client request object, a future, a response).
 * @param <E> The checked exception issuing the call may throw; {@link RuntimeException} if none.
 */
@FunctionalInterface
public interface OutboundRequestExecutor<R, E extends Throwable> {

    /**
     * Issues the call.
     *
     * @param request The request to send. Carries the trace headers, so send this one rather than the original.
     * @param call Where to report the response, its end, and errors.
     */
    R execute(OutboundRequest request, OutboundCall call) throws E;
}
