package com.nike.relay;

import com.nike.relay.metrics.SegmentRecorder;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * A timed node of work inside a {@link Transaction}'s tree. Segments are created through {@link Tracer} (never
 * directly), keep their children in creation order, and are ended exactly once - see {@link #end()}.
 *
 * <p>Capture rules:
 * <ul>
 *     <li>
 *         An {@link #isOpaque() opaque} segment hides whatever happens inside it. Segments started under it are
 *         still handed out (so instrumentation keeps working) but they are {@link #isCaptureSuppressed()
 *         suppressed}: they are never attached to the tree and never take attributes.
 *     </li>
 *     <li>
 *         Attributes can be written until the owning transaction ends, even after the segment itself has ended.
 *         Check {@link #canCaptureAttributes()} before doing any expensive attribute extraction.
 *     </li>
 *     <li>
 *         The name can be replaced or appended to until the owning transaction ends. After that it is frozen.
 *     </li>
 * </ul>
 *
 * <p>An inert segment ({@link #isRecording()} returns false) is handed out when there is no active transaction.
 * Every mutator on it is a no-op, so instrumentation code never needs a null check.
 *
 * <p>Segments implement {@link AutoCloseable} so blocking code can use try-with-resources:
 * <pre>
 *      try (Segment segment = Tracer.getInstance().startSegment(null, "Custom/doWork")) {
 *          // traced blocking work
 *      }
 * </pre>
 */
@SuppressWarnings("WeakerAccess")
public class Segment implements AutoCloseable {

    private final String segmentId;
    private final Transaction transaction;
    private final Segment parent;
    private final boolean opaque;
    private final boolean captureSuppressed;
    private final SegmentRecorder recorder;

    private final long startTimeEpochMicros;
    private final long startTimeNanos;

    private volatile String name;
    private volatile Long durationNanos;
    private volatile boolean unterminated;

    private volatile String catId;
    private volatile String catTransaction;

    private final List<Segment> children = Collections.synchronizedList(new ArrayList<Segment>());
    private final Map<String, Object> attributes = Collections.synchronizedMap(new LinkedHashMap<String, Object>());
    private final Map<String, Object> spanAttributes =
        Collections.synchronizedMap(new LinkedHashMap<String, Object>());

    Segment(Transaction transaction,
            Segment parent,
            String name,
            boolean opaque,
            boolean captureSuppressed,
            SegmentRecorder recorder) {
        this.segmentId = IdGenerator.generateId();
        this.transaction = transaction;
        this.parent = parent;
        this.name = (name == null) ? "" : name;
        this.opaque = opaque;
        this.captureSuppressed = opaque || captureSuppressed;
        this.recorder = recorder;
        this.startTimeEpochMicros = TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
        this.startTimeNanos = System.nanoTime();
    }

    /**
     * @return A placeholder segment that belongs to no transaction and records nothing.
     */
    static Segment newInertSegment(String name) {
        return new Segment(null, null, name, false, true, null);
    }

    public String getSegmentId() {
        return segmentId;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The owning transaction, or null for an inert segment.
     */
    public @Nullable Transaction getTransaction() {
        return transaction;
    }

    /**
     * @return The parent segment, or null for a transaction's root segment and for inert segments.
     */
    public @Nullable Segment getParent() {
        return parent;
    }

    public boolean isOpaque() {
        return opaque;
    }

    /**
     * @return true if this segment is opaque, or was started underneath an opaque (or itself suppressed) segment.
     * Suppressed segments are not part of the tree and never take attributes or children.
     */
    public boolean isCaptureSuppressed() {
        return captureSuppressed;
    }

    /**
     * @return false for the inert placeholder handed out when no transaction is active.
     */
    public boolean isRecording() {
        return transaction != null;
    }

    /**
     * @return true when attribute writes on this segment will be kept. Instrumentation should check this before
     * doing expensive attribute extraction.
     */
    public boolean canCaptureAttributes() {
        return transaction != null && !captureSuppressed && !transaction.isEnded();
    }

    public @Nullable SegmentRecorder getRecorder() {
        return recorder;
    }

    public long getStartTimeEpochMicros() {
        return startTimeEpochMicros;
    }

    public long getStartTimeNanos() {
        return startTimeNanos;
    }

    /**
     * @return The duration in nanoseconds, or null if the segment has not ended.
     */
    public @Nullable Long getDurationNanos() {
        return durationNanos;
    }

    public boolean isEnded() {
        return durationNanos != null;
    }

    /**
     * @return true if the owning transaction finished while this segment was still running.
     */
    public boolean isUnterminated() {
        return unterminated;
    }

    public @Nullable String getCatId() {
        return catId;
    }

    public @Nullable String getCatTransaction() {
        return catTransaction;
    }

    /**
     * @return A snapshot of the children in creation order.
     */
    public @NotNull List<Segment> getChildren() {
        synchronized (children) {
            return Collections.unmodifiableList(new ArrayList<>(children));
        }
    }

    /**
     * @return A snapshot of the attributes in insertion order.
     */
    public @NotNull Map<String, Object> getAttributes() {
        synchronized (attributes) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }

    /**
     * @return A snapshot of the span-only attributes (e.g. {@code http.statusCode}) in insertion order.
     */
    public @NotNull Map<String, Object> getSpanAttributes() {
        synchronized (spanAttributes) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(spanAttributes));
        }
    }

    /**
     * Adds an attribute. Silently ignored when {@link #canCaptureAttributes()} is false or the key is null.
     */
    public void addAttribute(String key, Object value) {
        if (key == null || !canCaptureAttributes()) {
            return;
        }

        attributes.put(key, value);
    }

    /**
     * Adds a span-only attribute. Silently ignored when {@link #canCaptureAttributes()} is false or the key is null.
     */
    public void addSpanAttribute(String key, Object value) {
        if (key == null || !canCaptureAttributes()) {
            return;
        }

        spanAttributes.put(key, value);
    }

    /**
     * Replaces the name. Ignored for blank names, inert segments, and once the owning transaction has ended.
     */
    public void setName(String newName) {
        if (StringUtils.isBlank(newName) || !isNameMutable()) {
            return;
        }

        synchronized (this) {
            this.name = newName;
        }
    }

    /**
     * Appends to the name (e.g. the resolved request path). Ignored for null/empty suffixes, inert segments, and once
     * the owning transaction has ended.
     */
    public void appendName(String suffix) {
        if (suffix == null || suffix.isEmpty() || !isNameMutable()) {
            return;
        }

        synchronized (this) {
            this.name = this.name + suffix;
        }
    }

    /**
     * Ends this segment through {@link Tracer#endSegment(Segment)}. Ending an already ended segment does nothing.
     */
    public void end() {
        Tracer.getInstance().endSegment(this);
    }

    /**
     * Same as {@link #end()}, for try-with-resources. Closing a segment that something else already ended is logged
     * as a usage error.
     */
    @Override
    public void close() {
        Tracer.getInstance().handleSegmentCloseMethod(this);
    }

    private boolean isNameMutable() {
        return transaction != null && !transaction.isEnded();
    }

    /**
     * Records the end timestamp, unless the owning transaction has already been completed: a completed transaction's
     * tree never changes, so a segment it left running stays {@link #isUnterminated() unterminated}.
     *
     * @return true if this call ended the segment, false if it was already ended, is inert, or its transaction is
     * completed.
     */
    boolean markEnded() {
        if (transaction == null) {
            return false;
        }

        synchronized (transaction) {
            if (transaction.isEnded()) {
                return false;
            }

            return recordEnd();
        }
    }

    /**
     * Ends the root segment while its transaction is being completed. Only transaction finalization uses this.
     *
     * @return true if this call ended the segment.
     */
    boolean markEndedOnCompletion() {
        if (transaction == null) {
            return false;
        }

        return recordEnd();
    }

    private synchronized boolean recordEnd() {
        if (durationNanos != null) {
            return false;
        }

        durationNanos = System.nanoTime() - startTimeNanos;
        return true;
    }

    void markUnterminated() {
        this.unterminated = true;
    }

    void addChild(Segment child) {
        children.add(child);
    }

    /**
     * Links this segment to the remote transaction that served it. Ignored once the owning transaction has ended.
     */
    public void setCatIdentifiers(String catId, String catTransaction) {
        if (!isNameMutable()) {
            return;
        }

        this.catId = catId;
        this.catTransaction = catTransaction;
    }

    /**
     * Renames without the frozen-name check. Only transaction finalization uses this, to apply normalized names.
     */
    void forceName(String newName) {
        this.name = newName;
    }

    @Override
    public String toString() {
        return "Segment{name='" + name + "', segmentId=" + segmentId
               + ", transactionId=" + ((transaction == null) ? null : transaction.getTransactionId())
               + ", ended=" + isEnded() + ", opaque=" + opaque + "}";
    }
}
