package com.nike.relay.http;

import com.nike.relay.config.TracerConfig;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the URLs and status codes seen by HTTP instrumentation.
 */
@SuppressWarnings("WeakerAccess")
public class UrlUtils {

    private static final Logger logger = LoggerFactory.getLogger(UrlUtils.class);

    private static final String SCHEME_SEPARATOR = "://";

    private UrlUtils() {
        // Nothing to do
    }

    /**
     * @return The path of the given URL without query string or fragment, or {@code /} when there is no path
     * starting with a slash.
     */
    public static @NotNull String scrub(String url) {
        if (url == null) {
            return "/";
        }

        String path = stripAuthority(url);

        int fragmentStart = path.indexOf('#');
        if (fragmentStart >= 0) {
            path = path.substring(0, fragmentStart);
        }

        int queryStart = path.indexOf('?');
        if (queryStart >= 0) {
            path = path.substring(0, queryStart);
        }

        return path.startsWith("/") ? path : "/";
    }

    /**
     * @return The query parameters of the given URL in order of appearance, URL decoded. A key without a value maps
     * to {@link Boolean#TRUE}, a repeated key maps to a list of its values.
     */
    public static @NotNull Map<String, Object> parseParameters(String url) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (url == null) {
            return parameters;
        }

        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return parameters;
        }

        String query = url.substring(queryStart + 1);
        int fragmentStart = query.indexOf('#');
        if (fragmentStart >= 0) {
            query = query.substring(0, fragmentStart);
        }

        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }

            int equalsIndex = pair.indexOf('=');
            String key = decode((equalsIndex < 0) ? pair : pair.substring(0, equalsIndex));
            Object value = (equalsIndex < 0) ? Boolean.TRUE : decode(pair.substring(equalsIndex + 1));

            addParameter(parameters, key, value);
        }

        return parameters;
    }

    @SuppressWarnings("unchecked")
    private static void addParameter(Map<String, Object> parameters, String key, Object value) {
        if (!parameters.containsKey(key)) {
            parameters.put(key, value);
            return;
        }

        Object existing = parameters.get(key);
        List<Object> values;
        if (existing instanceof List) {
            values = (List<Object>) existing;
        }
        else {
            values = new ArrayList<>();
            values.add(existing);
            parameters.put(key, values);
        }
        values.add(value);
    }

    /**
     * @return The URL's protocol (if absolute), scrubbed path, and query parameters.
     */
    public static @NotNull ParsedUrl scrubAndParseParameters(String url) {
        String protocol = null;
        if (url != null) {
            int schemeEnd = url.indexOf(SCHEME_SEPARATOR);
            int queryStart = url.indexOf('?');
            if (schemeEnd > 0 && (queryStart < 0 || schemeEnd < queryStart)) {
                protocol = url.substring(0, schemeEnd + 1).toLowerCase();
            }
        }

        return new ParsedUrl(protocol, scrub(url), parseParameters(url));
    }

    /**
     * @return true when the status code is an HTTP error (400 or above) that is not configured to be ignored. Accepts
     * numbers and numeric strings; anything else is never an error.
     */
    public static boolean isError(@Nullable TracerConfig config, @Nullable Object statusCode) {
        Integer code = toStatusCode(statusCode);
        return code != null && code >= 400 && !isIgnored(config, code);
    }

    /**
     * @return true when the status code is an HTTP error (400 or above) that is configured to be ignored.
     */
    public static boolean isIgnoredError(@Nullable TracerConfig config, @Nullable Object statusCode) {
        Integer code = toStatusCode(statusCode);
        return code != null && code >= 400 && isIgnored(config, code);
    }

    /**
     * Copies the entries of {@code source} whose key is not already present in {@code destination}. A key mapped to
     * null counts as present. Null arguments are ignored.
     */
    public static <V> void copyParameters(@Nullable Map<String, ? extends V> source,
                                          @Nullable Map<String, V> destination) {
        if (source == null || destination == null) {
            return;
        }

        for (Map.Entry<String, ? extends V> entry : source.entrySet()) {
            if (!destination.containsKey(entry.getKey())) {
                destination.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private static boolean isIgnored(TracerConfig config, int code) {
        return config != null && config.getIgnoreStatusCodes().contains(code);
    }

    private static Integer toStatusCode(Object statusCode) {
        if (statusCode == null) {
            return null;
        }

        if (statusCode instanceof Number) {
            return ((Number) statusCode).intValue();
        }

        try {
            return Integer.parseInt(statusCode.toString().trim());
        }
        catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric status code. status_code={}", statusCode);
            return null;
        }
    }

    private static String stripAuthority(String url) {
        int schemeEnd = url.indexOf(SCHEME_SEPARATOR);
        int queryStart = url.indexOf('?');
        if (schemeEnd < 0 || (queryStart >= 0 && queryStart < schemeEnd)) {
            return url;
        }

        int pathStart = url.indexOf('/', schemeEnd + SCHEME_SEPARATOR.length());
        if (pathStart < 0) {
            return "/";
        }

        return url.substring(pathStart);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        }
        catch (IllegalArgumentException e) {
            logger.debug("Keeping malformed URL encoded value as-is. value={}", value);
            return value;
        }
    }

    /**
     * The result of {@link #scrubAndParseParameters(String)}.
     */
    public static class ParsedUrl {

        private final String protocol;
        private final String path;
        private final Map<String, Object> parameters;

        public ParsedUrl(String protocol, String path, Map<String, Object> parameters) {
            this.protocol = protocol;
            this.path = path;
            this.parameters = (parameters == null)
                              ? Collections.<String, Object>emptyMap()
                              : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        /**
         * @return The protocol including the trailing colon (e.g. {@code https:}), or null for a relative URL.
         */
        public @Nullable String getProtocol() {
            return protocol;
        }

        public @NotNull String getPath() {
            return path;
        }

        public @NotNull Map<String, Object> getParameters() {
            return parameters;
        }
    }
}
