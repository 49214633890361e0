package com.nike.relay;

import com.nike.relay.http.HttpObjectForPropagation;
import com.nike.relay.http.HttpRequestTracingUtils;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One logical unit of observed work (usually one inbound request) and the tree of {@link Segment}s created while
 * doing it. Transactions are started and completed through {@link Tracer}:
 * {@link Tracer#startTransaction(String)} creates the transaction and its root segment, and
 * {@link Tracer#completeTransaction(Transaction)} finalizes it exactly once. Once {@link #isEnded()} returns true
 * the tree is frozen: no new segments, attributes or names.
 *
 * <p>Besides the tree, a transaction carries the cross-process identity used by the trace header protocols: its
 * {@link #getTripId() trip id}, the {@link #getReferringPathHash() referring path hash} it received, the path hashes it
 * sent out, and which header family ({@link HeaderMode}) it has committed to.
 */
@SuppressWarnings("WeakerAccess")
public class Transaction {

    /**
     * Whether the transaction was started by a web request or by something else (a job, a message, etc).
     */
    public enum Type {
        WEB,
        OTHER
    }

    /**
     * The header family a transaction uses for outbound calls. Mutually exclusive: the first outbound call that
     * attaches trace headers picks one and it never changes afterwards.
     */
    public enum HeaderMode {
        NONE,
        DISTRIBUTED_TRACING,
        CROSS_APPLICATION_TRACING
    }

    private final String transactionId;
    private final Type type;
    private final String traceId;
    private final String parentSpanId;
    private final long startTimeEpochMicros;
    private final long startTimeNanos;
    private final Segment rootSegment;

    private volatile String name;
    private volatile Segment baseSegment;
    private volatile Long durationNanos;
    private volatile boolean ended;

    private volatile String tripId;
    private volatile String referringPathHash;
    private volatile String referringTransactionGuid;
    private volatile String syntheticsHeader;
    private volatile Integer statusCode;
    private volatile boolean error;

    private final AtomicReference<HeaderMode> headerMode = new AtomicReference<>(HeaderMode.NONE);
    private final List<String> pathHashes = Collections.synchronizedList(new ArrayList<String>());
    private final List<Throwable> errors = Collections.synchronizedList(new ArrayList<Throwable>());

    Transaction(String name, Type type, String traceId, String parentSpanId) {
        this.transactionId = IdGenerator.generateId();
        this.name = (name == null) ? "" : name;
        this.type = (type == null) ? Type.OTHER : type;
        this.traceId = (StringUtils.isBlank(traceId)) ? IdGenerator.generateId() : traceId;
        this.parentSpanId = parentSpanId;
        this.startTimeEpochMicros = TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
        this.startTimeNanos = System.nanoTime();
        this.rootSegment = new Segment(this, null, this.name, false, false, null);
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The full display name used for path hashes and metric scoping.
     */
    public String getFullName() {
        return name;
    }

    /**
     * Replaces the display name. Ignored for blank names and once the transaction has ended.
     */
    public void setName(String newName) {
        if (StringUtils.isBlank(newName) || ended) {
            return;
        }

        this.name = newName;
    }

    public Type getType() {
        return type;
    }

    public boolean isWeb() {
        return type == Type.WEB;
    }

    /**
     * @return The distributed trace id: the inbound {@code X-B3-TraceId} when this transaction continues a remote
     * trace, a fresh id otherwise.
     */
    public String getTraceId() {
        return traceId;
    }

    /**
     * @return The remote caller's span id when this transaction continues a remote trace, otherwise null.
     */
    public @Nullable String getParentSpanId() {
        return parentSpanId;
    }

    public @NotNull Segment getRootSegment() {
        return rootSegment;
    }

    /**
     * @return The segment started with {@code isRoot=true} through
     * {@link Tracer#addSegment(String, com.nike.relay.metrics.SegmentRecorder, Segment, boolean, java.util.function.Function)},
     * or null.
     */
    public @Nullable Segment getBaseSegment() {
        return baseSegment;
    }

    void setBaseSegment(Segment baseSegment) {
        this.baseSegment = baseSegment;
    }

    /**
     * @return The root id of the chain of cross-process calls this transaction belongs to. Defaults to this
     * transaction's own id.
     */
    public String getTripId() {
        return (tripId == null) ? transactionId : tripId;
    }

    public void setTripId(String tripId) {
        this.tripId = tripId;
    }

    public @Nullable String getReferringPathHash() {
        return referringPathHash;
    }

    public void setReferringPathHash(String referringPathHash) {
        this.referringPathHash = referringPathHash;
    }

    public @Nullable String getReferringTransactionGuid() {
        return referringTransactionGuid;
    }

    public void setReferringTransactionGuid(String referringTransactionGuid) {
        this.referringTransactionGuid = referringTransactionGuid;
    }

    public @Nullable String getSyntheticsHeader() {
        return syntheticsHeader;
    }

    public void setSyntheticsHeader(String syntheticsHeader) {
        this.syntheticsHeader = syntheticsHeader;
    }

    /**
     * Appends to the history of path hashes this transaction has sent on outbound calls.
     */
    public void pushPathHash(String pathHash) {
        pathHashes.add(pathHash);
    }

    /**
     * @return A snapshot of the pushed path hashes, oldest first.
     */
    public @NotNull List<String> getPathHashes() {
        synchronized (pathHashes) {
            return Collections.unmodifiableList(new ArrayList<>(pathHashes));
        }
    }

    public HeaderMode getHeaderMode() {
        return headerMode.get();
    }

    /**
     * Commits this transaction to the given header family if it has not committed to one yet.
     *
     * @return The header family in effect after the call - which is the requested one unless an earlier call
     * already picked a different one.
     */
    public HeaderMode claimHeaderMode(HeaderMode desired) {
        if (desired == null || desired == HeaderMode.NONE) {
            return headerMode.get();
        }

        headerMode.compareAndSet(HeaderMode.NONE, desired);
        return headerMode.get();
    }

    /**
     * Adds the modern distributed trace headers for an outbound call made from the given segment.
     */
    public void insertDistributedTraceHeaders(Segment segment, final Map<String, String> outboundHeaders) {
        if (outboundHeaders == null) {
            return;
        }

        HttpRequestTracingUtils.propagateTracingHeaders(
            new HttpObjectForPropagation() {
                @Override
                public void setHeader(String headerKey, String headerValue) {
                    outboundHeaders.put(headerKey, headerValue);
                }
            },
            segment
        );
    }

    public @Nullable Integer getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(Integer statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * @return true if finalization flagged the transaction's status code as an error.
     */
    public boolean isError() {
        return error;
    }

    void markError() {
        this.error = true;
    }

    /**
     * Records an error that the instrumented code did not handle itself.
     */
    public void noticeError(Throwable throwable) {
        if (throwable != null && !ended) {
            errors.add(throwable);
        }
    }

    public @NotNull List<Throwable> getErrors() {
        synchronized (errors) {
            return Collections.unmodifiableList(new ArrayList<>(errors));
        }
    }

    public long getStartTimeEpochMicros() {
        return startTimeEpochMicros;
    }

    public long getStartTimeNanos() {
        return startTimeNanos;
    }

    /**
     * @return The duration in nanoseconds, or null if the transaction has not ended.
     */
    public @Nullable Long getDurationNanos() {
        return durationNanos;
    }

    public boolean isEnded() {
        return ended;
    }

    /**
     * @return Every segment of the tree in depth-first pre-order, starting with the root. Suppressed segments are
     * not part of the tree and therefore never included.
     */
    public @NotNull List<Segment> getSegments() {
        List<Segment> result = new ArrayList<>();
        Deque<Segment> toVisit = new ArrayDeque<>();
        toVisit.push(rootSegment);

        while (!toVisit.isEmpty()) {
            Segment current = toVisit.pop();
            result.add(current);

            List<Segment> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                toVisit.push(children.get(i));
            }
        }

        return result;
    }

    /**
     * @return The segments that were still running when the transaction ended.
     */
    public @NotNull List<Segment> getUnterminatedSegments() {
        List<Segment> result = new ArrayList<>();
        for (Segment segment : getSegments()) {
            if (segment.isUnterminated()) {
                result.add(segment);
            }
        }

        return result;
    }

    /**
     * Freezes the transaction.
     *
     * @return false if the transaction had already ended.
     */
    synchronized boolean markEnded() {
        if (ended) {
            return false;
        }

        durationNanos = System.nanoTime() - startTimeNanos;
        ended = true;
        return true;
    }

    /**
     * Adds {@code child} as the last child of {@code parent}, unless this transaction has already been completed.
     * Holds the same lock as {@link #markEnded()}, so a child is either attached before completion walks the tree or
     * not at all.
     *
     * @return true if the child was attached.
     */
    synchronized boolean attachChild(Segment parent, Segment child) {
        if (ended) {
            return false;
        }

        parent.addChild(child);
        return true;
    }

    void forceName(String newName) {
        this.name = newName;
    }

    @Override
    public String toString() {
        return "Transaction{name='" + name + "', transactionId=" + transactionId + ", tripId=" + getTripId()
               + ", ended=" + ended + "}";
    }
}
