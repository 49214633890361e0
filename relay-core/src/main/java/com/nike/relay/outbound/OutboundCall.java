package com.nike.relay.outbound;

import com.nike.relay.Segment;
import com.nike.relay.http.ResponseWithHeaders;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Callable;

/**
 * Handle given to an {@link OutboundRequestExecutor} for reporting what happens to an outbound call after it has been
 * issued. The adapter for the HTTP client in use forwards the client's response, end and error events here, usually
 * from I/O threads: every method can be called from any thread.
 *
 * <p>A call that is not observed (no active transaction, an opaque parent, an unusable host or port) gets
 * {@link #NOOP}.
 */
public interface OutboundCall {

    /**
     * @return The external segment measuring the call, or null for an unobserved call.
     */
    @Nullable Segment getSegment();

    /**
     * Records the response status as span attributes and reads the callee's cross-application response header when
     * that protocol is in use.
     */
    void responseReceived(ResponseWithHeaders response);

    /**
     * The response has been fully consumed. Ends the segment.
     */
    void responseEnded();

    /**
     * The call failed. Ends the segment and, when nobody else handles the error, records it on the transaction.
     *
     * @param error The failure.
     * @param handledByCaller true when the application registered its own error handling for the call.
     */
    void errorOccurred(Throwable error, boolean handledByCaller);

    /**
     * @return The runnable bound to the call's segment, for listeners the adapter registers on the client.
     */
    Runnable bind(Runnable runnable);

    /**
     * @return The callable bound to the call's segment, for listeners the adapter registers on the client.
     */
    <T> Callable<T> bind(Callable<T> callable);

    /**
     * Handle for unobserved calls. Does nothing and binds nothing.
     */
    OutboundCall NOOP = new OutboundCall() {
        @Override
        public Segment getSegment() {
            return null;
        }

        @Override
        public void responseReceived(ResponseWithHeaders response) {
            // Nothing to do
        }

        @Override
        public void responseEnded() {
            // Nothing to do
        }

        @Override
        public void errorOccurred(Throwable error, boolean handledByCaller) {
            // Nothing to do
        }

        @Override
        public Runnable bind(Runnable runnable) {
            return runnable;
        }

        @Override
        public <T> Callable<T> bind(Callable<T> callable) {
            return callable;
        }

        @Override
        public String toString() {
            return "OutboundCall.NOOP";
        }
    };
}
