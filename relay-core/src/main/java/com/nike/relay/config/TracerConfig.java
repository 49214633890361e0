package com.nike.relay.config;

import com.nike.relay.Tracer.TransactionLoggingRepresentation;
import com.nike.relay.cat.Obfuscator;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable snapshot of the settings {@link com.nike.relay.Tracer} works with: local settings (application names,
 * which trace header protocols are enabled, logging format) merged with the values the remote configuration service
 * pushes (encoding key, cross process id, trusted account ids). Replace the whole snapshot through
 * {@link com.nike.relay.Tracer#setConfig(TracerConfig)} when anything changes; use {@link #toBuilder()} to derive the
 * next one.
 *
 * <p>Build instances with {@link #newBuilder()}, or from {@code relay.*} properties with
 * {@link #fromProperties(Properties)}.
 */
@SuppressWarnings("WeakerAccess")
public class TracerConfig {

    private static final Logger logger = LoggerFactory.getLogger(TracerConfig.class);

    public static final String APP_NAME_PROPERTY = "relay.app_name";
    public static final String DISTRIBUTED_TRACING_ENABLED_PROPERTY = "relay.distributed_tracing.enabled";
    public static final String CROSS_APPLICATION_TRACER_ENABLED_PROPERTY = "relay.cross_application_tracer.enabled";
    public static final String ENCODING_KEY_PROPERTY = "relay.encoding_key";
    public static final String CROSS_PROCESS_ID_PROPERTY = "relay.cross_process_id";
    public static final String TRUSTED_ACCOUNT_IDS_PROPERTY = "relay.trusted_account_ids";
    public static final String IGNORE_STATUS_CODES_PROPERTY = "relay.error_collector.ignore_status_codes";
    public static final String TRANSACTION_LOGGING_FORMAT_PROPERTY = "relay.transaction_logging_format";

    private final List<String> applicationNames;
    private final boolean distributedTracingEnabled;
    private final boolean crossApplicationTracerEnabled;
    private final String encodingKey;
    private final String crossProcessId;
    private final Set<Long> trustedAccountIds;
    private final Set<Integer> ignoreStatusCodes;
    private final TransactionLoggingRepresentation transactionLoggingRepresentation;

    private TracerConfig(Builder builder) {
        this.applicationNames = Collections.unmodifiableList(new ArrayList<>(builder.applicationNames));
        this.distributedTracingEnabled = builder.distributedTracingEnabled;
        this.crossApplicationTracerEnabled = builder.crossApplicationTracerEnabled;
        this.encodingKey = builder.encodingKey;
        this.crossProcessId = builder.crossProcessId;
        this.trustedAccountIds = (builder.trustedAccountIds == null)
                                 ? null
                                 : Collections.unmodifiableSet(new LinkedHashSet<>(builder.trustedAccountIds));
        this.ignoreStatusCodes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.ignoreStatusCodes));
        this.transactionLoggingRepresentation = builder.transactionLoggingRepresentation;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return A builder initialized with the values of this instance.
     */
    public Builder toBuilder() {
        return new Builder()
            .withApplicationNames(applicationNames)
            .withDistributedTracingEnabled(distributedTracingEnabled)
            .withCrossApplicationTracerEnabled(crossApplicationTracerEnabled)
            .withEncodingKey(encodingKey)
            .withCrossProcessId(crossProcessId)
            .withTrustedAccountIds(trustedAccountIds)
            .withIgnoreStatusCodes(ignoreStatusCodes)
            .withTransactionLoggingRepresentation(transactionLoggingRepresentation);
    }

    /**
     * Builds a config from {@code relay.*} properties. Missing properties keep their defaults, values that cannot be
     * parsed are logged and skipped.
     */
    public static TracerConfig fromProperties(Properties props) {
        Builder builder = newBuilder();
        if (props == null) {
            return builder.build();
        }

        String appNames = props.getProperty(APP_NAME_PROPERTY);
        if (appNames != null) {
            builder.withApplicationNames(splitCommaSeparated(appNames));
        }

        String dtEnabled = props.getProperty(DISTRIBUTED_TRACING_ENABLED_PROPERTY);
        if (!StringUtils.isBlank(dtEnabled)) {
            builder.withDistributedTracingEnabled(Boolean.parseBoolean(dtEnabled.trim()));
        }

        String catEnabled = props.getProperty(CROSS_APPLICATION_TRACER_ENABLED_PROPERTY);
        if (!StringUtils.isBlank(catEnabled)) {
            builder.withCrossApplicationTracerEnabled(Boolean.parseBoolean(catEnabled.trim()));
        }

        String encodingKey = props.getProperty(ENCODING_KEY_PROPERTY);
        if (!StringUtils.isBlank(encodingKey)) {
            builder.withEncodingKey(encodingKey);
        }

        String crossProcessId = props.getProperty(CROSS_PROCESS_ID_PROPERTY);
        if (!StringUtils.isBlank(crossProcessId)) {
            builder.withCrossProcessId(crossProcessId.trim());
        }

        String trustedIds = props.getProperty(TRUSTED_ACCOUNT_IDS_PROPERTY);
        if (trustedIds != null) {
            Set<Long> parsed = new LinkedHashSet<>();
            for (String id : splitCommaSeparated(trustedIds)) {
                try {
                    parsed.add(Long.parseLong(id));
                }
                catch (NumberFormatException e) {
                    logger.warn("Skipping unparsable trusted account id. property={}, value={}",
                                TRUSTED_ACCOUNT_IDS_PROPERTY, id);
                }
            }
            builder.withTrustedAccountIds(parsed);
        }

        String ignoreCodes = props.getProperty(IGNORE_STATUS_CODES_PROPERTY);
        if (ignoreCodes != null) {
            Set<Integer> parsed = new LinkedHashSet<>();
            for (String code : splitCommaSeparated(ignoreCodes)) {
                try {
                    parsed.add(Integer.parseInt(code));
                }
                catch (NumberFormatException e) {
                    logger.warn("Skipping unparsable status code. property={}, value={}",
                                IGNORE_STATUS_CODES_PROPERTY, code);
                }
            }
            builder.withIgnoreStatusCodes(parsed);
        }

        String loggingFormat = props.getProperty(TRANSACTION_LOGGING_FORMAT_PROPERTY);
        if (!StringUtils.isBlank(loggingFormat)) {
            try {
                builder.withTransactionLoggingRepresentation(
                    TransactionLoggingRepresentation.valueOf(loggingFormat.trim().toUpperCase())
                );
            }
            catch (IllegalArgumentException e) {
                logger.warn("Unknown transaction logging format, keeping the default. property={}, value={}",
                            TRANSACTION_LOGGING_FORMAT_PROPERTY, loggingFormat);
            }
        }

        return builder.build();
    }

    private static List<String> splitCommaSeparated(String value) {
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public @NotNull List<String> getApplicationNames() {
        return applicationNames;
    }

    /**
     * @return The first application name, used when computing cross-application path hashes. Null when no name is
     * configured.
     */
    public @Nullable String getPrimaryApplicationName() {
        return applicationNames.isEmpty() ? null : applicationNames.get(0);
    }

    public boolean isDistributedTracingEnabled() {
        return distributedTracingEnabled;
    }

    public boolean isCrossApplicationTracerEnabled() {
        return crossApplicationTracerEnabled;
    }

    public @Nullable String getEncodingKey() {
        return encodingKey;
    }

    public @Nullable String getCrossProcessId() {
        return crossProcessId;
    }

    /**
     * @return The trusted account ids, or null when the service never sent a trust list (which turns off inbound
     * cross-application processing).
     */
    public @Nullable Set<Long> getTrustedAccountIds() {
        return trustedAccountIds;
    }

    public boolean isTrustedAccount(long accountId) {
        return trustedAccountIds != null && trustedAccountIds.contains(accountId);
    }

    public @NotNull Set<Integer> getIgnoreStatusCodes() {
        return ignoreStatusCodes;
    }

    public TransactionLoggingRepresentation getTransactionLoggingRepresentation() {
        return transactionLoggingRepresentation;
    }

    /**
     * @return The cross process id obfuscated with the encoding key, as sent in the {@code x-newrelic-id} header, or
     * null when either is missing.
     */
    public @Nullable String getObfuscatedId() {
        if (StringUtils.isBlank(crossProcessId) || StringUtils.isBlank(encodingKey)) {
            return null;
        }

        return Obfuscator.obfuscate(crossProcessId, encodingKey);
    }

    @Override
    public String toString() {
        // The encoding key stays out of logs.
        return "TracerConfig{applicationNames=" + applicationNames
               + ", distributedTracingEnabled=" + distributedTracingEnabled
               + ", crossApplicationTracerEnabled=" + crossApplicationTracerEnabled
               + ", encodingKeyPresent=" + (encodingKey != null)
               + ", crossProcessId=" + crossProcessId
               + ", trustedAccountIds=" + trustedAccountIds
               + ", ignoreStatusCodes=" + ignoreStatusCodes
               + ", transactionLoggingRepresentation=" + transactionLoggingRepresentation
               + "}";
    }

    /**
     * {@code TracerConfig} builder static inner class.
     */
    public static final class Builder {

        private List<String> applicationNames = new ArrayList<>();
        private boolean distributedTracingEnabled = false;
        private boolean crossApplicationTracerEnabled = true;
        private String encodingKey;
        private String crossProcessId;
        private Set<Long> trustedAccountIds;
        private Set<Integer> ignoreStatusCodes = new LinkedHashSet<>();
        private TransactionLoggingRepresentation transactionLoggingRepresentation =
            TransactionLoggingRepresentation.JSON;

        private Builder() {
        }

        public Builder withApplicationNames(Collection<String> val) {
            applicationNames = (val == null) ? new ArrayList<String>() : new ArrayList<>(val);
            return this;
        }

        public Builder withDistributedTracingEnabled(boolean val) {
            distributedTracingEnabled = val;
            return this;
        }

        public Builder withCrossApplicationTracerEnabled(boolean val) {
            crossApplicationTracerEnabled = val;
            return this;
        }

        public Builder withEncodingKey(String val) {
            encodingKey = val;
            return this;
        }

        public Builder withCrossProcessId(String val) {
            crossProcessId = val;
            return this;
        }

        /**
         * Null turns inbound cross-application processing off, an empty collection trusts nobody.
         */
        public Builder withTrustedAccountIds(Collection<Long> val) {
            trustedAccountIds = (val == null) ? null : new LinkedHashSet<>(val);
            return this;
        }

        public Builder withIgnoreStatusCodes(Collection<Integer> val) {
            ignoreStatusCodes = (val == null) ? new LinkedHashSet<Integer>() : new LinkedHashSet<>(val);
            return this;
        }

        public Builder withTransactionLoggingRepresentation(TransactionLoggingRepresentation val) {
            if (val == null) {
                throw new IllegalArgumentException("transactionLoggingRepresentation cannot be null.");
            }

            transactionLoggingRepresentation = val;
            return this;
        }

        public TracerConfig build() {
            return new TracerConfig(this);
        }
    }
}
