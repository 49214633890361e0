package com.nike.relay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nike.relay.Segment;
import com.nike.relay.Transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Renders finished transactions for the transaction loggers, either as a JSON document holding the whole segment tree
 * ({@link #toJson(Transaction)}) or as a single {@code key=value} line ({@link #toKeyValueString(Transaction)}).
 */
@SuppressWarnings("WeakerAccess")
public class TransactionSerializer {

    private static final Logger logger = LoggerFactory.getLogger(TransactionSerializer.class);

    /** Corresponds to {@link Transaction#getTransactionId()}. */
    public static final String TRANSACTION_ID_FIELD = "transactionId";
    /** Corresponds to {@link Transaction#getName()} and {@link Segment#getName()}. */
    public static final String NAME_FIELD = "name";
    /** Corresponds to {@link Transaction#getType()}. */
    public static final String TYPE_FIELD = "type";
    /** Corresponds to {@link Transaction#getTraceId()}. */
    public static final String TRACE_ID_FIELD = "traceId";
    /** Corresponds to {@link Transaction#getParentSpanId()}. */
    public static final String PARENT_SPAN_ID_FIELD = "parentSpanId";
    /** Corresponds to {@link Transaction#getTripId()}. */
    public static final String TRIP_ID_FIELD = "tripId";
    /** Corresponds to {@link Transaction#getHeaderMode()}. */
    public static final String HEADER_MODE_FIELD = "headerMode";
    /** Corresponds to {@link Transaction#getPathHashes()}. */
    public static final String PATH_HASHES_FIELD = "pathHashes";
    /** Corresponds to {@link Transaction#getStatusCode()}. */
    public static final String STATUS_CODE_FIELD = "statusCode";
    /** Corresponds to {@link Transaction#isError()}. */
    public static final String ERROR_FIELD = "error";
    /** Corresponds to the start time of a transaction or segment. */
    public static final String START_TIME_EPOCH_MICROS_FIELD = "startTimeEpochMicros";
    /** Corresponds to the duration of a transaction or segment. */
    public static final String DURATION_NANOS_FIELD = "durationNanos";
    /** The root segment and its descendants. */
    public static final String ROOT_SEGMENT_FIELD = "rootSegment";
    /** Corresponds to {@link Segment#getSegmentId()}. */
    public static final String SEGMENT_ID_FIELD = "segmentId";
    /** Corresponds to {@link Segment#isUnterminated()}. */
    public static final String UNTERMINATED_FIELD = "unterminated";
    /** Corresponds to {@link Segment#isOpaque()}. */
    public static final String OPAQUE_FIELD = "opaque";
    /** Corresponds to {@link Segment#getCatId()}. */
    public static final String CAT_ID_FIELD = "catId";
    /** Corresponds to {@link Segment#getCatTransaction()}. */
    public static final String CAT_TRANSACTION_FIELD = "catTransaction";
    /** Corresponds to {@link Segment#getAttributes()}. */
    public static final String ATTRIBUTES_FIELD = "attributes";
    /** Corresponds to {@link Segment#getSpanAttributes()}. */
    public static final String SPAN_ATTRIBUTES_FIELD = "spanAttributes";
    /** Corresponds to {@link Segment#getChildren()}. */
    public static final String CHILDREN_FIELD = "children";
    /** The number of segments in the tree. */
    public static final String SEGMENT_COUNT_FIELD = "segmentCount";
    /** The names of the unterminated segments. */
    public static final String UNTERMINATED_SEGMENTS_FIELD = "unterminatedSegments";

    private static final ObjectMapper objectMapper =
        new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private TransactionSerializer() {
        // Nothing to do
    }

    /**
     * @return The transaction and its whole segment tree as a JSON document. Attribute values that Jackson cannot
     * serialize are rendered with {@code toString()}.
     */
    public static String toJson(Transaction transaction) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(TRANSACTION_ID_FIELD, transaction.getTransactionId());
        root.put(NAME_FIELD, transaction.getName());
        root.put(TYPE_FIELD, transaction.getType().name());
        root.put(TRACE_ID_FIELD, transaction.getTraceId());
        root.put(PARENT_SPAN_ID_FIELD, transaction.getParentSpanId());
        root.put(TRIP_ID_FIELD, transaction.getTripId());
        root.put(HEADER_MODE_FIELD, transaction.getHeaderMode().name());
        ArrayNode pathHashes = root.putArray(PATH_HASHES_FIELD);
        for (String pathHash : transaction.getPathHashes()) {
            pathHashes.add(pathHash);
        }
        root.put(STATUS_CODE_FIELD, transaction.getStatusCode());
        root.put(ERROR_FIELD, transaction.isError());
        root.put(START_TIME_EPOCH_MICROS_FIELD, transaction.getStartTimeEpochMicros());
        root.put(DURATION_NANOS_FIELD, transaction.getDurationNanos());
        root.set(ROOT_SEGMENT_FIELD, segmentToJsonNode(transaction.getRootSegment()));

        try {
            return objectMapper.writeValueAsString(root);
        }
        catch (JsonProcessingException e) {
            logger.error("Unable to serialize transaction to JSON. transaction_id={}",
                         transaction.getTransactionId(), e);
            return toKeyValueString(transaction);
        }
    }

    /**
     * @return The transaction's fields and a summary of its tree as one {@code key=value,key=value} line.
     */
    public static String toKeyValueString(Transaction transaction) {
        List<Segment> segments = transaction.getSegments();
        StringBuilder unterminated = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isUnterminated()) {
                if (unterminated.length() > 0) {
                    unterminated.append(',');
                }
                unterminated.append(segment.getName());
            }
        }

        StringBuilder builder = new StringBuilder();
        builder.append(TRANSACTION_ID_FIELD).append("=").append(transaction.getTransactionId());
        builder.append(",").append(NAME_FIELD).append("=").append(transaction.getName());
        builder.append(",").append(TYPE_FIELD).append("=").append(transaction.getType().name());
        builder.append(",").append(TRACE_ID_FIELD).append("=").append(transaction.getTraceId());
        builder.append(",").append(PARENT_SPAN_ID_FIELD).append("=").append(transaction.getParentSpanId());
        builder.append(",").append(TRIP_ID_FIELD).append("=").append(transaction.getTripId());
        builder.append(",").append(HEADER_MODE_FIELD).append("=").append(transaction.getHeaderMode().name());
        builder.append(",").append(STATUS_CODE_FIELD).append("=").append(transaction.getStatusCode());
        builder.append(",").append(ERROR_FIELD).append("=").append(transaction.isError());
        builder.append(",").append(START_TIME_EPOCH_MICROS_FIELD).append("=")
               .append(transaction.getStartTimeEpochMicros());
        if (transaction.isEnded()) {
            builder.append(",").append(DURATION_NANOS_FIELD).append("=").append(transaction.getDurationNanos());
        }
        builder.append(",").append(SEGMENT_COUNT_FIELD).append("=").append(segments.size());
        if (unterminated.length() > 0) {
            builder.append(",").append(UNTERMINATED_SEGMENTS_FIELD).append("=[").append(unterminated).append("]");
        }

        return builder.toString();
    }

    protected static ObjectNode segmentToJsonNode(Segment segment) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(SEGMENT_ID_FIELD, segment.getSegmentId());
        node.put(NAME_FIELD, segment.getName());
        node.put(START_TIME_EPOCH_MICROS_FIELD, segment.getStartTimeEpochMicros());
        node.put(DURATION_NANOS_FIELD, segment.getDurationNanos());
        if (segment.isUnterminated()) {
            node.put(UNTERMINATED_FIELD, true);
        }
        if (segment.isOpaque()) {
            node.put(OPAQUE_FIELD, true);
        }
        if (segment.getCatId() != null) {
            node.put(CAT_ID_FIELD, segment.getCatId());
            node.put(CAT_TRANSACTION_FIELD, segment.getCatTransaction());
        }
        putAttributes(node, ATTRIBUTES_FIELD, segment.getAttributes());
        putAttributes(node, SPAN_ATTRIBUTES_FIELD, segment.getSpanAttributes());

        List<Segment> children = segment.getChildren();
        if (!children.isEmpty()) {
            ArrayNode childNodes = node.putArray(CHILDREN_FIELD);
            for (Segment child : children) {
                childNodes.add(segmentToJsonNode(child));
            }
        }

        return node;
    }

    private static void putAttributes(ObjectNode node, String fieldName, Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return;
        }

        ObjectNode attributesNode = node.putObject(fieldName);
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            try {
                attributesNode.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
            }
            catch (IllegalArgumentException e) {
                logger.debug("Attribute value is not JSON serializable, using toString(). key={}", entry.getKey());
                attributesNode.put(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
    }
}
