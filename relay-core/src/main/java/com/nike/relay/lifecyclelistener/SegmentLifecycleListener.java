package com.nike.relay.lifecyclelistener;

import com.nike.relay.Segment;
import com.nike.relay.Transaction;

/**
 * Listener interface for {@link com.nike.relay.Tracer} that allows you to be notified during segment and transaction
 * lifecycle events. Call {@link com.nike.relay.Tracer#addSegmentLifecycleListener(SegmentLifecycleListener)} to add a
 * specific listener.
 * <p/>
 * IMPORTANT NOTE: These methods are called on the application's threads, inline with the instrumented work. Keep them
 *                 cheap, and hand anything expensive (shipping finished transactions somewhere, for example) off to a
 *                 separate thread or threadpool. Exceptions thrown from a listener are logged and otherwise ignored.
 *
 * @author Nic Munroe
 */
public interface SegmentLifecycleListener {

    /**
     * Called when a segment attached to a transaction tree is started, including the transaction's root segment.
     * Inert and suppressed segments are not reported.
     */
    void segmentStarted(Segment segment);

    /**
     * Called once per segment, the first time it is ended.
     */
    void segmentCompleted(Segment segment);

    /**
     * Called once per transaction after it has been finalized: names are normalized and frozen, unterminated segments
     * are flagged, and metrics have been recorded. This is the hand-off point for the finished segment tree.
     */
    void transactionCompleted(Transaction transaction);

}
