package com.nike.relay.cat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nike.relay.MetricNames;
import com.nike.relay.Segment;
import com.nike.relay.Transaction;
import com.nike.relay.config.TracerConfig;
import com.nike.relay.http.HttpRequestTracingUtils;
import com.nike.relay.http.RequestWithHeaders;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeSet;

import static com.nike.relay.TraceHeaders.NEWRELIC_ID;
import static com.nike.relay.TraceHeaders.NEWRELIC_SYNTHETICS;
import static com.nike.relay.TraceHeaders.NEWRELIC_TRANSACTION;

/**
 * The legacy cross-application tracing ("CAT") protocol.
 *
 * <p>Outbound, a caller sends its obfuscated cross process id in {@code x-newrelic-id} and the obfuscated JSON array
 * {@code [transactionId, false, tripId, pathHash]} in {@code x-newrelic-transaction}. The callee answers with the
 * obfuscated {@code x-newrelic-app-data} response header, a JSON array whose first element is the callee's
 * {@code accountId#applicationId} and whose second is the callee's transaction name. Response data is only used when
 * the account id is on the trust list; otherwise it is dropped with a trace log.
 *
 * <p>Nothing in this class throws on bad remote data: it is logged and ignored.
 */
@SuppressWarnings("WeakerAccess")
public class CrossApplicationTracing {

    private static final Logger logger = LoggerFactory.getLogger(CrossApplicationTracing.class);

    public static final String TRANSACTION_GUID_ATTRIBUTE = "transaction_guid";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private CrossApplicationTracing() {
        // Nothing to do
    }

    /**
     * Adds the outbound CAT headers for a call made by the given transaction, and pushes the call's path hash onto the
     * transaction. Requires an encoding key; callers check that first.
     */
    public static void addCatHeaders(TracerConfig config, Transaction transaction, Map<String, String> outboundHeaders) {
        String obfuscatedId = config.getObfuscatedId();
        if (obfuscatedId != null) {
            outboundHeaders.put(NEWRELIC_ID, obfuscatedId);
        }

        String fullName = transaction.getFullName();
        String pathHash = PathHashes.calculatePathHash(
            config.getPrimaryApplicationName(),
            (fullName == null) ? "" : fullName,
            transaction.getReferringPathHash()
        );
        transaction.pushPathHash(pathHash);

        try {
            String txData = objectMapper.writeValueAsString(
                Arrays.asList(transaction.getTransactionId(), false, transaction.getTripId(), pathHash)
            );
            outboundHeaders.put(NEWRELIC_TRANSACTION, Obfuscator.obfuscate(txData, config.getEncodingKey()));

            logger.trace("Added outbound request CAT headers in transaction {}", transaction.getTransactionId());
        }
        catch (JsonProcessingException e) {
            logger.trace("Failed to create CAT payload", e);
        }
    }

    /**
     * Reads the callee's {@code x-newrelic-app-data} response header. When it comes from a trusted account the segment
     * is linked to the callee ({@link Segment#setCatIdentifiers(String, String)}), renamed to
     * {@code ExternalTransaction/<host>/<catId>/<catTransaction>}, and given the callee's transaction guid (6th
     * element) as the {@value #TRANSACTION_GUID_ATTRIBUTE} attribute when present.
     */
    public static void pullCatHeaders(TracerConfig config, Segment segment, String host, String obfuscatedAppData) {
        if (StringUtils.isBlank(config.getEncodingKey())) {
            logger.trace("No encoding key is set - not parsing response CAT headers");
            return;
        }

        if (config.getTrustedAccountIds() == null) {
            logger.trace("No trusted account ids are set - not parsing response CAT headers");
            return;
        }

        if (StringUtils.isBlank(obfuscatedAppData)) {
            logger.trace("Got no CAT app data in response header x-newrelic-app-data");
            return;
        }

        JsonNode appData = deobfuscateJson(obfuscatedAppData, config.getEncodingKey());
        if (appData == null) {
            logger.warn("Got an unparsable CAT header x-newrelic-app-data: {}", obfuscatedAppData);
            return;
        }

        if (!appData.isArray() || appData.size() == 0 || !appData.get(0).isTextual()) {
            logger.trace("CAT app data was not an array starting with a cross process id: {}", appData);
            return;
        }

        String catId = appData.get(0).asText();
        if (!isTrusted(config, catId)) {
            logger.trace("Response from untrusted CAT header account id: {}", catId);
            return;
        }

        String catTransaction = (appData.size() > 1) ? textOf(appData.get(1)) : null;
        segment.setCatIdentifiers(catId, catTransaction);
        segment.setName(MetricNames.EXTERNAL_TRANSACTION + host + "/" + catId + "/" + catTransaction);
        if (appData.size() >= 6) {
            segment.addAttribute(TRANSACTION_GUID_ATTRIBUTE, textOf(appData.get(5)));
        }

        Transaction transaction = segment.getTransaction();
        logger.trace("Got inbound response CAT headers in transaction {}",
                     (transaction == null) ? null : transaction.getTransactionId());
    }

    /**
     * Reads the CAT request headers of an inbound request into the given transaction: the referring transaction
     * guid, the trip id and the referring path hash from {@code x-newrelic-transaction}, but only when
     * {@code x-newrelic-id} identifies a trusted account. The synthetics header is kept as received.
     */
    public static void handleInboundRequest(TracerConfig config, Transaction transaction, RequestWithHeaders request) {
        String encodingKey = config.getEncodingKey();
        if (StringUtils.isBlank(encodingKey) || request == null) {
            logger.trace("No encoding key is set - not parsing request CAT headers");
            return;
        }

        String synthetics = HttpRequestTracingUtils.getHeaderWithAttributeAsBackup(request, NEWRELIC_SYNTHETICS);
        if (synthetics != null) {
            transaction.setSyntheticsHeader(synthetics);
        }

        String obfuscatedId = HttpRequestTracingUtils.getHeaderWithAttributeAsBackup(request, NEWRELIC_ID);
        if (obfuscatedId == null) {
            logger.trace("Got no CAT id in request header x-newrelic-id");
            return;
        }

        String callerId;
        try {
            callerId = Obfuscator.deobfuscate(obfuscatedId, encodingKey);
        }
        catch (IllegalArgumentException e) {
            logger.trace("Got an undecodable CAT header x-newrelic-id: {}", obfuscatedId, e);
            return;
        }

        if (!isTrusted(config, callerId)) {
            logger.trace("Request from untrusted CAT header account id: {}", callerId);
            return;
        }

        String obfuscatedTransaction = HttpRequestTracingUtils.getHeaderWithAttributeAsBackup(
            request, NEWRELIC_TRANSACTION
        );
        if (obfuscatedTransaction == null) {
            return;
        }

        JsonNode txData = deobfuscateJson(obfuscatedTransaction, encodingKey);
        if (txData == null || !txData.isArray()) {
            logger.warn("Got an unparsable CAT header x-newrelic-transaction: {}", obfuscatedTransaction);
            return;
        }

        if (txData.size() > 0 && txData.get(0).isTextual()) {
            transaction.setReferringTransactionGuid(txData.get(0).asText());
        }
        if (txData.size() > 2 && txData.get(2).isTextual()) {
            transaction.setTripId(txData.get(2).asText());
        }
        if (txData.size() > 3 && txData.get(3).isTextual()) {
            transaction.setReferringPathHash(txData.get(3).asText());
        }

        logger.trace("Got inbound request CAT headers in transaction {}", transaction.getTransactionId());
    }

    /**
     * @return The distinct path hashes the transaction pushed on outbound calls, other than the hash its current name
     * produces, sorted and comma separated. Null when there are none.
     */
    public static @Nullable String alternatePathHashes(TracerConfig config, Transaction transaction) {
        String currentHash = PathHashes.calculatePathHash(
            config.getPrimaryApplicationName(),
            (transaction.getFullName() == null) ? "" : transaction.getFullName(),
            transaction.getReferringPathHash()
        );

        TreeSet<String> alternates = new TreeSet<>(transaction.getPathHashes());
        alternates.remove(currentHash);

        return alternates.isEmpty() ? null : String.join(",", alternates);
    }

    /**
     * @return true when the account id at the start of {@code crossProcessId} (the text before the first {@code #}) is
     * trusted. Anything that is not a plain decimal account id is untrusted.
     */
    public static boolean isTrusted(TracerConfig config, String crossProcessId) {
        Long accountId = parseAccountId(crossProcessId);
        return accountId != null && config.isTrustedAccount(accountId);
    }

    /**
     * @return The account id before the first {@code #}, or null unless it is made of ASCII digits only and fits in a
     * long.
     */
    public static @Nullable Long parseAccountId(String crossProcessId) {
        if (crossProcessId == null) {
            return null;
        }

        int hashIndex = crossProcessId.indexOf('#');
        String accountId = (hashIndex < 0) ? crossProcessId : crossProcessId.substring(0, hashIndex);
        if (accountId.isEmpty() || accountId.length() > 19) {
            return null;
        }

        for (int i = 0; i < accountId.length(); i++) {
            char c = accountId.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }

        try {
            return Long.parseLong(accountId);
        }
        catch (NumberFormatException e) {
            logger.trace("Account id does not fit in a long: {}", accountId);
            return null;
        }
    }

    private static JsonNode deobfuscateJson(String obfuscated, String encodingKey) {
        try {
            return objectMapper.readTree(Obfuscator.deobfuscate(obfuscated, encodingKey));
        }
        catch (IOException | IllegalArgumentException e) {
            logger.trace("Unable to deobfuscate CAT payload", e);
            return null;
        }
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        return node.isTextual() ? node.asText() : node.toString();
    }
}
