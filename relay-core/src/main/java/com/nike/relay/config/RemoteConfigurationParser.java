package com.nike.relay.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nike.relay.normalizer.SegmentTermsNormalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates the settings pushed by the remote configuration service and merges them into a {@link TracerConfig}.
 *
 * <p>Recognized keys:
 * <ul>
 *     <li>{@value #ENCODING_KEY} - a non-blank string, anything else clears the key.</li>
 *     <li>{@value #CROSS_PROCESS_ID} - a non-blank string, anything else clears the id.</li>
 *     <li>
 *         {@value #TRUSTED_ACCOUNT_IDS} - an array of integers. A non-array clears the trust list (inbound
 *         cross-application processing turns off); non-integral entries are dropped.
 *     </li>
 *     <li>{@value #TRANSACTION_SEGMENT_TERMS} - handed to {@link SegmentTermsNormalizer#load(JsonNode)}.</li>
 * </ul>
 * Keys missing from the payload leave the corresponding setting alone.
 */
@SuppressWarnings("WeakerAccess")
public class RemoteConfigurationParser {

    private static final Logger logger = LoggerFactory.getLogger(RemoteConfigurationParser.class);

    public static final String ENCODING_KEY = "encoding_key";
    public static final String CROSS_PROCESS_ID = "cross_process_id";
    public static final String TRUSTED_ACCOUNT_IDS = "trusted_account_ids";
    public static final String TRANSACTION_SEGMENT_TERMS = "transaction_segment_terms";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final SegmentTermsNormalizer segmentTermsNormalizer;

    public RemoteConfigurationParser(SegmentTermsNormalizer segmentTermsNormalizer) {
        if (segmentTermsNormalizer == null) {
            throw new IllegalArgumentException("segmentTermsNormalizer cannot be null");
        }

        this.segmentTermsNormalizer = segmentTermsNormalizer;
    }

    /**
     * Parses the JSON text and delegates to {@link #apply(JsonNode, TracerConfig)}. Unparsable text is logged and
     * {@code current} is returned unchanged.
     */
    public TracerConfig apply(String serverConfigJson, TracerConfig current) {
        try {
            return apply(objectMapper.readTree(serverConfigJson), current);
        }
        catch (IOException | IllegalArgumentException e) {
            logger.warn("Unable to parse the remote configuration payload. The current configuration will be kept.", e);
            return current;
        }
    }

    /**
     * @return A new config: {@code current} with the recognized settings of {@code serverConfig} applied.
     */
    public TracerConfig apply(JsonNode serverConfig, TracerConfig current) {
        TracerConfig base = (current == null) ? TracerConfig.newBuilder().build() : current;
        if (serverConfig == null || !serverConfig.isObject()) {
            logger.warn("Remote configuration payload was not a JSON object. The current configuration will be kept.");
            return base;
        }

        TracerConfig.Builder builder = base.toBuilder();

        if (serverConfig.has(ENCODING_KEY)) {
            builder.withEncodingKey(nonBlankText(serverConfig.get(ENCODING_KEY), ENCODING_KEY));
        }

        if (serverConfig.has(CROSS_PROCESS_ID)) {
            builder.withCrossProcessId(nonBlankText(serverConfig.get(CROSS_PROCESS_ID), CROSS_PROCESS_ID));
        }

        if (serverConfig.has(TRUSTED_ACCOUNT_IDS)) {
            builder.withTrustedAccountIds(parseTrustedAccountIds(serverConfig.get(TRUSTED_ACCOUNT_IDS)));
        }

        if (serverConfig.has(TRANSACTION_SEGMENT_TERMS)) {
            segmentTermsNormalizer.load(serverConfig.get(TRANSACTION_SEGMENT_TERMS));
        }

        return builder.build();
    }

    protected static String nonBlankText(JsonNode node, String key) {
        if (node == null || !node.isTextual() || node.asText().trim().isEmpty()) {
            logger.warn("Remote configuration value was not a non-blank string and will be treated as missing. key={}",
                        key);
            return null;
        }

        return node.asText();
    }

    protected static List<Long> parseTrustedAccountIds(JsonNode node) {
        if (node == null || !node.isArray()) {
            logger.warn("Remote configuration value was not an array, cross application tracing will not trust any "
                        + "inbound data. key={}", TRUSTED_ACCOUNT_IDS);
            return null;
        }

        List<Long> ids = new ArrayList<>(node.size());
        for (JsonNode id : node) {
            if (id.isIntegralNumber() && id.canConvertToLong()) {
                ids.add(id.asLong());
            }
            else {
                logger.debug("Dropping non-integral trusted account id. value={}", id);
            }
        }

        return ids;
    }
}
