package com.nike.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.nike.relay.cat.CrossApplicationTracing;
import com.nike.relay.config.RemoteConfigurationParser;
import com.nike.relay.config.TracerConfig;
import com.nike.relay.http.HttpRequestTracingUtils;
import com.nike.relay.http.RequestWithHeaders;
import com.nike.relay.http.UrlUtils;
import com.nike.relay.lifecyclelistener.SegmentLifecycleListener;
import com.nike.relay.metrics.MetricSink;
import com.nike.relay.metrics.NoOpMetricSink;
import com.nike.relay.metrics.SegmentRecorder;
import com.nike.relay.normalizer.SegmentTermsNormalizer;
import com.nike.relay.util.TracingState;
import com.nike.relay.util.TransactionSerializer;
import com.nike.relay.util.asynchelperwrapper.BiFunctionWithTracing;
import com.nike.relay.util.asynchelperwrapper.CallableWithTracing;
import com.nike.relay.util.asynchelperwrapper.ConsumerWithTracing;
import com.nike.relay.util.asynchelperwrapper.FunctionWithTracing;
import com.nike.relay.util.asynchelperwrapper.RunnableWithTracing;
import com.nike.relay.util.asynchelperwrapper.SupplierWithTracing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.nike.relay.util.AsyncRelayHelper.linkTracingToCurrentThread;
import static com.nike.relay.util.AsyncRelayHelper.unlinkTracingFromCurrentThread;

/**
 * <p>
 *     Entry point for instrumentation. {@link Tracer} starts and completes {@link Transaction}s, creates their
 *     {@link Segment}s, and keeps track of the "ambient" segment: the segment in scope for the code currently running
 *     on this thread. Instrumentation hooks use the ambient segment as the default parent of new segments.
 * </p>
 * <p>
 *     The ambient segment is held in a {@link ThreadLocal} and mirrored into the SLF4J
 *     <a href="http://www.slf4j.org/manual.html#mdc">MDC</a> under {@value #TRANSACTION_ID_MDC_KEY} and
 *     {@value #SEGMENT_ID_MDC_KEY}, so adding {@code %X{transactionId}} to a log pattern tags every log message with the
 *     transaction it belongs to. Nothing in the thread-local is shared between transactions. Whenever work hops to
 *     another thread (worker pools, timers, I/O callbacks) the context has to be carried explicitly:
 *     <ul>
 *         <li>
 *             {@link #addSegment(String, SegmentRecorder, Segment, boolean, Function)} makes a new segment ambient
 *             for the synchronous extent of a handler, so continuations bound inside the handler capture it.
 *         </li>
 *         <li>
 *             {@link #bindRunnable(Runnable, Segment)}, {@link #bindFunction(Function, Segment)} and friends wrap a
 *             continuation so that each invocation, on whatever thread, runs with the bound segment ambient and then
 *             restores whatever was ambient before.
 *         </li>
 *         <li>
 *             {@link com.nike.relay.util.asynchelperwrapper.ExecutorServiceWithTracing} does the same for every task
 *             submitted to an executor.
 *         </li>
 *     </ul>
 * </p>
 * <p>
 *     When a transaction is completed ({@link #completeTransaction(Transaction)}) its names are normalized and frozen,
 *     segments that never ended are flagged as unterminated, metrics are recorded into the {@link MetricSink}, and the
 *     finished tree is logged to a SLF4J logger named {@value #VALID_RELAY_TRANSACTIONS_LOGGER_NAME} (or
 *     {@value #INVALID_RELAY_TRANSACTIONS_LOGGER_NAME} when some segment was unterminated) so you can pipe them to
 *     their own log file if desired. These specially-named loggers are not used for any other purpose.
 * </p>
 * <p>
 *     Failures inside tracing never reach the instrumented code: missing context produces inert segments, bad remote
 *     data is logged and dropped, and listener or recorder exceptions are logged. Exceptions thrown by the
 *     instrumented code itself propagate untouched, and ambient state is always restored.
 * </p>
 * <p>
 *     Blocking code can use try-with-resources:
 *     <pre>
 *          Tracer tracer = Tracer.getInstance();
 *          Transaction tx = tracer.startTransaction("WebTransaction/Uri/orders", Transaction.Type.WEB);
 *          try {
 *              try (Segment segment = tracer.startSegment(null, "Custom/loadOrders")) {
 *                  // traced blocking work
 *              }
 *          }
 *          finally {
 *              tracer.completeTransaction(tx);
 *          }
 *     </pre>
 * </p>
 *
 * @author Nic Munroe
 * @author Robert Roeser
 */
@SuppressWarnings("WeakerAccess")
public class Tracer {

    /**
     * The options for how finished {@link Transaction}s are represented in the transaction logs. Configured through
     * {@link TracerConfig#getTransactionLoggingRepresentation()}.
     */
    public enum TransactionLoggingRepresentation {
        /**
         * Causes transactions to be logged using {@link TransactionSerializer#toJson(Transaction)}.
         */
        JSON,
        /**
         * Causes transactions to be logged using {@link TransactionSerializer#toKeyValueString(Transaction)}.
         */
        KEY_VALUE
    }

    public static final String VALID_RELAY_TRANSACTIONS_LOGGER_NAME = "VALID_RELAY_TRANSACTIONS";
    public static final String INVALID_RELAY_TRANSACTIONS_LOGGER_NAME = "INVALID_RELAY_TRANSACTIONS";

    private static final Logger classLogger = LoggerFactory.getLogger(Tracer.class);
    private static final Logger validTransactionLogger = LoggerFactory.getLogger(VALID_RELAY_TRANSACTIONS_LOGGER_NAME);
    private static final Logger invalidTransactionLogger =
        LoggerFactory.getLogger(INVALID_RELAY_TRANSACTIONS_LOGGER_NAME);

    /**
     * MDC key for the ambient segment's transaction id.
     */
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    /**
     * MDC key for the ambient segment's id.
     */
    public static final String SEGMENT_ID_MDC_KEY = "segmentId";

    /**
     * The ambient segment of the current thread.
     */
    private static final ThreadLocal<Segment> currentSegmentThreadLocal = new ThreadLocal<>();

    private static final Tracer INSTANCE = new Tracer();

    private volatile TracerConfig config = TracerConfig.newBuilder().build();

    /**
     * Guards replacing {@link #config}, so a remote configuration merge never works from a stale snapshot.
     */
    private final Object configLock = new Object();

    private volatile MetricSink metricSink = NoOpMetricSink.getDefaultInstance();

    private final SegmentTermsNormalizer segmentTermsNormalizer = new SegmentTermsNormalizer();

    private final RemoteConfigurationParser remoteConfigurationParser =
        new RemoteConfigurationParser(segmentTermsNormalizer);

    private final List<SegmentLifecycleListener> segmentLifecycleListeners = new CopyOnWriteArrayList<>();

    private Tracer() { /* Intentionally private to enforce singleton pattern. */ }

    /**
     * @return The singleton instance of this class.
     */
    public static Tracer getInstance() {
        return INSTANCE;
    }

    /**
     * @return The ambient segment for this thread, or null if there is none.
     */
    public @Nullable Segment getSegment() {
        return currentSegmentThreadLocal.get();
    }

    /**
     * @return The transaction of the ambient segment, or null if there is none.
     */
    public @Nullable Transaction getTransaction() {
        Segment segment = getSegment();
        return (segment == null) ? null : segment.getTransaction();
    }

    /**
     * Same as {@link #startTransaction(String, Transaction.Type)} with {@link Transaction.Type#OTHER}.
     */
    public Transaction startTransaction(String name) {
        return startTransaction(name, Transaction.Type.OTHER, null);
    }

    /**
     * Same as {@link #startTransaction(String, Transaction.Type, RequestWithHeaders)} without an inbound request.
     */
    public Transaction startTransaction(String name, Transaction.Type type) {
        return startTransaction(name, type, null);
    }

    /**
     * Starts a new transaction and makes its root segment the ambient segment for this thread.
     *
     * <p>When an inbound request is given, the transaction continues the caller's trace: with distributed tracing
     * enabled the B3 trace id and span id are picked up, otherwise (when cross application tracing is enabled) the
     * caller's CAT request headers are processed.
     *
     * <p><b>WARNING:</b> This replaces whatever was ambient on this thread. Call it at the entry point of new work,
     * never in the middle of an existing transaction.
     *
     * @param name The transaction name - should never be null.
     * @param type Web or other; null means {@link Transaction.Type#OTHER}.
     * @param inboundRequest The inbound request, or null.
     */
    public Transaction startTransaction(String name, Transaction.Type type, @Nullable RequestWithHeaders inboundRequest) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }

        TracerConfig currentConfig = config;
        String traceId = null;
        String parentSpanId = null;
        if (inboundRequest != null && currentConfig.isDistributedTracingEnabled()) {
            traceId = HttpRequestTracingUtils.getTraceId(inboundRequest);
            if (traceId != null) {
                parentSpanId = HttpRequestTracingUtils.getSpanId(inboundRequest);
            }
        }

        Transaction transaction = new Transaction(name, type, traceId, parentSpanId);

        if (inboundRequest != null
            && currentConfig.isCrossApplicationTracerEnabled()
            && !currentConfig.isDistributedTracingEnabled()) {
            CrossApplicationTracing.handleInboundRequest(currentConfig, transaction, inboundRequest);
        }

        Segment existing = getSegment();
        if (existing != null && existing.getTransaction() != null && !existing.getTransaction().isEnded()) {
            classLogger.error(
                "RELAY USAGE ERROR - We were asked to start a new transaction but this thread still had a segment of "
                + "an unfinished transaction registered. This probably means completeTransaction() was not called or "
                + "unregisterFromThread() was skipped the last time this thread worked on that transaction. The old "
                + "transaction is left as it is. relay_usage_error=true, dirty_thread_state=true, "
                + "lost_transaction_id={}",
                existing.getTransaction().getTransactionId(), new Exception("Stack trace for debugging purposes")
            );
        }

        setAmbient(transaction.getRootSegment());
        classLogger.debug("** starting transaction {}", transaction);

        notifySegmentStarted(transaction.getRootSegment());

        return transaction;
    }

    /**
     * Same as {@link #startSegment(Segment, String, boolean, SegmentRecorder)} with a non-opaque segment and no
     * recorder.
     */
    public @NotNull Segment startSegment(@Nullable Segment parent, String name) {
        return startSegment(parent, name, false, null);
    }

    /**
     * Creates a segment as the last child of {@code parent}, or of the ambient segment when {@code parent} is null.
     * Does not change the ambient segment - see {@link #addSegment(String, SegmentRecorder, Segment, boolean, Function)}
     * for that.
     *
     * <ul>
     *     <li>
     *         Without an active transaction (no parent, an inert parent, or a transaction that already ended) an
     *         inert placeholder is returned. Every operation on it is a no-op.
     *     </li>
     *     <li>
     *         Under an opaque (or suppressed) parent the segment is still created, but it is suppressed: it is not
     *         attached to the tree and takes no attributes. Check {@link Segment#canCaptureAttributes()} before doing
     *         expensive attribute extraction.
     *     </li>
     * </ul>
     *
     * @param parent The parent, or null for the ambient segment.
     * @param name The segment name.
     * @param opaque Whether the new segment hides its own descendants.
     * @param recorder Turns the finished segment into metrics, may be null.
     */
    public @NotNull Segment startSegment(@Nullable Segment parent,
                                         String name,
                                         boolean opaque,
                                         @Nullable SegmentRecorder recorder) {
        Segment effectiveParent = (parent == null) ? getSegment() : parent;
        Transaction transaction = (effectiveParent == null) ? null : effectiveParent.getTransaction();

        if (transaction == null || transaction.isEnded()) {
            classLogger.debug("No active transaction, segment will not be recorded. segment_name={}", name);
            return Segment.newInertSegment(name);
        }

        if (effectiveParent.isCaptureSuppressed()) {
            classLogger.trace(
                "Parent segment is opaque, the new segment will not be captured. segment_name={}, parent_name={}",
                name, effectiveParent.getName()
            );
            return new Segment(transaction, effectiveParent, name, opaque, true, recorder);
        }

        Segment segment = new Segment(transaction, effectiveParent, name, opaque, false, recorder);
        if (!transaction.attachChild(effectiveParent, segment)) {
            classLogger.debug("Transaction completed while the segment was being started, segment will not be "
                              + "recorded. segment_name={}", name);
            return Segment.newInertSegment(name);
        }

        notifySegmentStarted(segment);

        return segment;
    }

    /**
     * Ends the given segment. Idempotent: only the first call records the end time and notifies listeners. Does not
     * touch the segment's children or the ambient segment. Once the segment's transaction has been completed this does
     * nothing, so a segment left running at completion stays unterminated.
     */
    public void endSegment(@Nullable Segment segment) {
        if (segment == null) {
            return;
        }

        if (!segment.markEnded()) {
            classLogger.trace(
                "Segment was already ended, is inert, or its transaction was completed, ignoring. segment={}", segment
            );
            return;
        }

        if (!segment.isCaptureSuppressed()) {
            notifySegmentCompleted(segment);
        }
    }

    /**
     * Called by {@link Segment#close()}. Closing an already ended segment is a usage error (try-with-resources should
     * be the only thing ending it): it is logged and ignored.
     */
    void handleSegmentCloseMethod(Segment segment) {
        if (segment.isRecording() && segment.isEnded()) {
            classLogger.error(
                "RELAY USAGE ERROR - An attempt was made to close() a segment that was already ended. "
                + "This call to Segment.close() will be ignored. "
                + "relay_usage_error=true, already_ended_segment=true, transaction_id={}, segment_id={}",
                segment.getTransaction().getTransactionId(), segment.getSegmentId(),
                new Exception("Stack trace for debugging purposes")
            );
            return;
        }

        endSegment(segment);
    }

    /**
     * Same as {@link #addSegment(String, SegmentRecorder, Segment, boolean, Function)} with no recorder, the ambient
     * segment as parent, and {@code isRoot=false}.
     */
    public <T> T addSegment(String name, Function<Segment, T> handler) {
        return addSegment(name, null, null, false, handler);
    }

    /**
     * Creates a segment (see {@link #startSegment(Segment, String, boolean, SegmentRecorder)}) and calls
     * {@code handler} with it, synchronously, with the new segment ambient. Anything bound during the handler (through
     * the {@code bind*} methods or the async wrappers) captures the new segment. The previous ambient state is
     * restored when the handler returns or throws; exceptions from the handler propagate unchanged.
     *
     * <p>The segment is not ended here: whoever finishes the work it measures ends it, possibly on another thread.
     *
     * @param name The segment name.
     * @param recorder Turns the finished segment into metrics, may be null.
     * @param parent The parent, or null for the ambient segment.
     * @param isRoot When true the new segment becomes its transaction's {@link Transaction#getBaseSegment()}.
     * @param handler The work to run with the new segment.
     * @return Whatever the handler returns.
     */
    public <T> T addSegment(String name,
                            @Nullable SegmentRecorder recorder,
                            @Nullable Segment parent,
                            boolean isRoot,
                            Function<Segment, T> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        Segment segment = startSegment(parent, name, false, recorder);
        if (!segment.isRecording()) {
            return handler.apply(segment);
        }

        if (isRoot && !segment.isCaptureSuppressed()) {
            segment.getTransaction().setBaseSegment(segment);
        }

        TracingState originalThreadInfo = null;
        try {
            originalThreadInfo = linkTracingToCurrentThread(segment, MDC.getCopyOfContextMap());

            return handler.apply(segment);
        }
        finally {
            unlinkTracingFromCurrentThread(originalThreadInfo);
        }
    }

    /**
     * @return A runnable that runs {@code runnable} with {@code segment} (or, when null, the current ambient segment)
     * ambient on whatever thread invokes it, then restores the invoking thread's previous state.
     */
    public Runnable bindRunnable(Runnable runnable, @Nullable Segment segment) {
        return new RunnableWithTracing(runnable, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    /**
     * Like {@link #bindRunnable(Runnable, Segment)}, for a {@link Callable}.
     */
    public <T> Callable<T> bindCallable(Callable<T> callable, @Nullable Segment segment) {
        return new CallableWithTracing<>(callable, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    /**
     * Like {@link #bindRunnable(Runnable, Segment)}, for a {@link Supplier}.
     */
    public <T> Supplier<T> bindSupplier(Supplier<T> supplier, @Nullable Segment segment) {
        return new SupplierWithTracing<>(supplier, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    /**
     * Binds a continuation to a segment: every invocation of the returned function (any number of times, from any
     * thread, including from inside another binding) runs {@code fn} with {@code segment} ambient for exactly the
     * duration of that invocation and restores the previous ambient segment afterwards.
     *
     * @param fn The continuation.
     * @param segment The segment to bind to, or null for the current ambient segment.
     */
    public <T, R> Function<T, R> bindFunction(Function<T, R> fn, @Nullable Segment segment) {
        return new FunctionWithTracing<>(fn, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    /**
     * Like {@link #bindFunction(Function, Segment)}, for a {@link Consumer}.
     */
    public <T> Consumer<T> bindConsumer(Consumer<T> consumer, @Nullable Segment segment) {
        return new ConsumerWithTracing<>(consumer, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    /**
     * Like {@link #bindFunction(Function, Segment)}, for a {@link BiFunction}.
     */
    public <T, U, R> BiFunction<T, U, R> bindBiFunction(BiFunction<T, U, R> fn, @Nullable Segment segment) {
        return new BiFunctionWithTracing<>(fn, segmentToBind(segment), MDC.getCopyOfContextMap());
    }

    private Segment segmentToBind(Segment segment) {
        return (segment == null) ? getSegment() : segment;
    }

    /**
     * Completes the transaction of the ambient segment, if any.
     */
    public void completeTransaction() {
        Transaction transaction = getTransaction();
        if (transaction == null) {
            classLogger.error(
                "RELAY USAGE ERROR - Expected an ambient transaction to complete, but there was none. "
                + "relay_usage_error=true, missing_transaction=true",
                new Exception("Stack trace for debugging purposes")
            );
            return;
        }

        completeTransaction(transaction);
    }

    /**
     * Finalizes the given transaction. Exactly once per transaction; later calls are logged as usage errors and
     * ignored.
     *
     * <ol>
     *     <li>The root segment is ended and the tree is frozen.</li>
     *     <li>Every other segment that never ended is flagged {@link Segment#isUnterminated() unterminated}.</li>
     *     <li>With segment terms rules loaded, the transaction name and every segment name are normalized.</li>
     *     <li>The transaction is flagged as an error when its status code is an unignored HTTP error.</li>
     *     <li>Segment recorders write their metrics to the {@link MetricSink}.</li>
     *     <li>The tree is logged, listeners are notified, and the ambient state is cleared if it belongs to this
     *     transaction.</li>
     * </ol>
     */
    public void completeTransaction(Transaction transaction) {
        if (transaction == null) {
            return;
        }

        if (!transaction.markEnded()) {
            classLogger.error(
                "RELAY USAGE ERROR - An attempt was made to complete a transaction that was already completed. "
                + "This call will be ignored. relay_usage_error=true, already_completed_transaction=true, "
                + "transaction_id={}",
                transaction.getTransactionId(), new Exception("Stack trace for debugging purposes")
            );
            return;
        }

        TracerConfig currentConfig = config;

        Segment rootSegment = transaction.getRootSegment();
        if (rootSegment.markEndedOnCompletion()) {
            notifySegmentCompleted(rootSegment);
        }

        List<Segment> segments = transaction.getSegments();
        boolean hasUnterminatedSegments = false;
        for (Segment segment : segments) {
            if (!segment.isEnded()) {
                segment.markUnterminated();
                hasUnterminatedSegments = true;
            }
        }

        if (segmentTermsNormalizer.hasRules()) {
            transaction.forceName(segmentTermsNormalizer.normalize(transaction.getName()).getValue());
            for (Segment segment : segments) {
                segment.forceName(segmentTermsNormalizer.normalize(segment.getName()).getValue());
            }
        }

        Integer statusCode = transaction.getStatusCode();
        if (statusCode != null && UrlUtils.isError(currentConfig, statusCode)) {
            transaction.markError();
        }

        recordMetrics(transaction, segments);

        logTransaction(transaction, currentConfig, hasUnterminatedSegments);

        notifyTransactionCompleted(transaction);

        Segment ambient = getSegment();
        if (ambient != null && ambient.getTransaction() == transaction) {
            unregisterFromThread();
        }
    }

    protected void recordMetrics(Transaction transaction, List<Segment> segments) {
        MetricSink sink = metricSink;
        for (Segment segment : segments) {
            SegmentRecorder recorder = segment.getRecorder();
            if (recorder == null || segment.isUnterminated()) {
                continue;
            }

            try {
                recorder.record(segment, transaction.getName(), sink);
            }
            catch (Exception e) {
                classLogger.warn("Segment recorder failed, metrics for this segment are lost. recorder={}, segment={}",
                                 recorder, segment, e);
            }
        }
    }

    protected void logTransaction(Transaction transaction, TracerConfig currentConfig, boolean hasUnterminatedSegments) {
        Logger loggerToUse = hasUnterminatedSegments ? invalidTransactionLogger : validTransactionLogger;
        if (!loggerToUse.isInfoEnabled()) {
            return;
        }

        String infoTag = hasUnterminatedSegments ? "[UNTERMINATED_SEGMENTS] " : "";
        loggerToUse.info("{}[RELAY_TRANSACTION] {}", infoTag,
                         serializeTransactionToDesiredStringRepresentation(transaction, currentConfig));
    }

    /**
     * Uses the configured {@link TransactionLoggingRepresentation} to serialize the given transaction.
     */
    protected String serializeTransactionToDesiredStringRepresentation(Transaction transaction,
                                                                       TracerConfig currentConfig) {
        TransactionLoggingRepresentation representation = currentConfig.getTransactionLoggingRepresentation();
        switch (representation) {
            case JSON:
                return TransactionSerializer.toJson(transaction);
            case KEY_VALUE:
                return TransactionSerializer.toKeyValueString(transaction);
            default:
                throw new IllegalStateException("Unknown transaction logging representation type: " + representation);
        }
    }

    /**
     * @return A copy of this thread's tracing state: the ambient segment and the MDC.
     */
    public TracingState getCurrentTracingStateCopy() {
        return new TracingState(getSegment(), MDC.getCopyOfContextMap());
    }

    /**
     * Makes the given segment ambient on this thread and points the MDC at it. Null clears the ambient segment.
     *
     * <p>This is the low level hook for frameworks that juggle several requests on one thread: register the request's
     * segment whenever the thread starts a chunk of work for it, and {@link #unregisterFromThread()} (in a finally
     * block) when the chunk is done. Prefer the {@code bind*} methods and the async wrappers, which do this for you.
     */
    public void registerWithThread(@Nullable Segment segment) {
        Segment existing = getSegment();
        if (existing != null && existing != segment && segment != null
            && existing.getTransaction() != null && existing.getTransaction() != segment.getTransaction()
            && !existing.getTransaction().isEnded()) {
            classLogger.error(
                "RELAY USAGE ERROR - We were asked to register a segment with this thread but a segment of a "
                + "different, unfinished transaction was still registered. This probably means unregisterFromThread() "
                + "was not called the last time that transaction's work left this thread. The old transaction is left "
                + "as it is. relay_usage_error=true, dirty_thread_state=true, replaced_transaction_id={}",
                existing.getTransaction().getTransactionId(), new Exception("Stack trace for debugging purposes")
            );
        }

        setAmbient(segment);
    }

    /**
     * Clears the ambient segment and its MDC entries from this thread.
     *
     * @return The segment that was ambient, or null.
     */
    public @Nullable Segment unregisterFromThread() {
        Segment currentValue = currentSegmentThreadLocal.get();
        currentSegmentThreadLocal.remove();
        unconfigureMDC();
        return currentValue;
    }

    private void setAmbient(Segment segment) {
        if (segment == null) {
            currentSegmentThreadLocal.remove();
            unconfigureMDC();
            return;
        }

        currentSegmentThreadLocal.set(segment);
        configureMDC(segment);
    }

    protected static void configureMDC(Segment segment) {
        Transaction transaction = segment.getTransaction();
        if (transaction == null) {
            unconfigureMDC();
            return;
        }

        MDC.put(TRANSACTION_ID_MDC_KEY, transaction.getTransactionId());
        MDC.put(SEGMENT_ID_MDC_KEY, segment.getSegmentId());
    }

    protected static void unconfigureMDC() {
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(SEGMENT_ID_MDC_KEY);
    }

    /**
     * @return The active configuration snapshot. Never null.
     */
    public @NotNull TracerConfig getConfig() {
        return config;
    }

    /**
     * Replaces the active configuration snapshot. Work already in flight may still see the previous snapshot.
     */
    public void setConfig(TracerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null.");
        }

        synchronized (configLock) {
            this.config = config;
        }
    }

    /**
     * Applies a remote configuration payload (see {@link RemoteConfigurationParser}): the settings it carries replace
     * those of the current snapshot, and its segment terms rules replace the current rules. Concurrent calls are
     * applied one after the other, each on top of the previous result.
     */
    public void applyRemoteConfiguration(JsonNode serverConfig) {
        synchronized (configLock) {
            setConfig(remoteConfigurationParser.apply(serverConfig, config));
        }
    }

    /**
     * @return The process wide segment terms normalizer used when transactions are completed.
     */
    public SegmentTermsNormalizer getSegmentTermsNormalizer() {
        return segmentTermsNormalizer;
    }

    public MetricSink getMetricSink() {
        return metricSink;
    }

    public void setMetricSink(MetricSink metricSink) {
        if (metricSink == null) {
            throw new IllegalArgumentException("metricSink cannot be null.");
        }

        this.metricSink = metricSink;
    }

    /**
     * Adds a listener that will be notified of segment and transaction lifecycle events. Listeners run inline on the
     * application's threads - keep them cheap.
     */
    public void addSegmentLifecycleListener(SegmentLifecycleListener listener) {
        if (listener != null)
            this.segmentLifecycleListeners.add(listener);
    }

    public boolean removeSegmentLifecycleListener(SegmentLifecycleListener listener) {
        //noinspection SimplifiableIfStatement
        if (listener == null)
            return false;

        return this.segmentLifecycleListeners.remove(listener);
    }

    public void removeAllSegmentLifecycleListeners() {
        this.segmentLifecycleListeners.clear();
    }

    /**
     * @return The current listeners, unmodifiable.
     */
    public List<SegmentLifecycleListener> getSegmentLifecycleListeners() {
        return Collections.unmodifiableList(this.segmentLifecycleListeners);
    }

    protected void notifySegmentStarted(Segment segment) {
        for (SegmentLifecycleListener listener : segmentLifecycleListeners) {
            try {
                listener.segmentStarted(segment);
            }
            catch (Exception e) {
                classLogger.warn("SegmentLifecycleListener.segmentStarted failed. listener={}", listener, e);
            }
        }
    }

    protected void notifySegmentCompleted(Segment segment) {
        for (SegmentLifecycleListener listener : segmentLifecycleListeners) {
            try {
                listener.segmentCompleted(segment);
            }
            catch (Exception e) {
                classLogger.warn("SegmentLifecycleListener.segmentCompleted failed. listener={}", listener, e);
            }
        }
    }

    protected void notifyTransactionCompleted(Transaction transaction) {
        for (SegmentLifecycleListener listener : segmentLifecycleListeners) {
            try {
                listener.transactionCompleted(transaction);
            }
            catch (Exception e) {
                classLogger.warn("SegmentLifecycleListener.transactionCompleted failed. listener={}", listener, e);
            }
        }
    }
}
