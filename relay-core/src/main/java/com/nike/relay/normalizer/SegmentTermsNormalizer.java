package com.nike.relay.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites slash delimited transaction and segment names into stable metric names using the segment terms rules
 * pushed by the remote configuration service.
 *
 * <p>For a path, the first rule whose prefix is a literal prefix of the path is applied: the prefix is kept, every
 * following path component that is one of the rule's terms is kept verbatim, every other component becomes
 * {@value #PLACEHOLDER}, and runs of placeholders collapse into one. With the rule
 * {@code {"prefix": "a/b/", "terms": ["x", "y"]}} the path {@code a/b/x/q/y/z} normalizes to
 * <code>a/b/x/&#42;/y/&#42;</code>.
 *
 * <p>The rule list is replaced wholesale by {@link #load(JsonNode)}. The new generation is validated and built aside
 * and then published through a volatile field, so concurrent {@link #normalize(String)} calls always see one complete
 * generation.
 */
@SuppressWarnings("WeakerAccess")
public class SegmentTermsNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SegmentTermsNormalizer.class);

    public static final String PLACEHOLDER = "*";
    public static final String SEPARATOR = "/";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private volatile List<TermRule> rules = Collections.emptyList();

    /**
     * @return The rules currently in effect, in evaluation order. Never null, never modifiable.
     */
    public @NotNull List<TermRule> getRules() {
        return rules;
    }

    public boolean hasRules() {
        return !rules.isEmpty();
    }

    /**
     * Parses the given JSON text and delegates to {@link #load(JsonNode)}. Unparsable text is logged and the current
     * rules are kept.
     */
    public void load(String json) {
        if (json == null) {
            logger.warn("transaction_segment_terms was null. The current rules will be kept.");
            return;
        }

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(json);
        }
        catch (IOException e) {
            logger.warn("Unable to parse transaction_segment_terms. The current rules will be kept. json={}", json, e);
            return;
        }

        load(parsed);
    }

    /**
     * Replaces the current rules with the valid rules of the given JSON array. Anything other than an array is logged
     * and ignored, leaving the current rules in place.
     */
    public void load(JsonNode json) {
        if (json == null || !json.isArray()) {
            logger.warn(
                "transaction_segment_terms was not an array. The current rules will be kept. received_type={}",
                (json == null) ? null : json.getNodeType()
            );
            return;
        }

        this.rules = filterRules(json);
    }

    /**
     * Clears all rules. Every path is returned unmatched afterwards.
     */
    public void clear() {
        this.rules = Collections.emptyList();
    }

    /**
     * Normalizes the given path with the first rule that applies to it.
     *
     * @return {@code matched=true} and the normalized name if a rule applied, otherwise {@code matched=false} and the
     * path unchanged.
     */
    public @NotNull NormalizationResult normalize(String path) {
        if (path == null) {
            return new NormalizationResult(false, null);
        }

        // Read the volatile once so the whole call works against one generation.
        List<TermRule> currentRules = this.rules;
        for (TermRule rule : currentRules) {
            if (!rule.appliesTo(path)) {
                continue;
            }

            String[] parts = path.substring(rule.getPrefix().length()).split(SEPARATOR, -1);
            List<String> result = new ArrayList<>(parts.length);
            String previous = null;
            for (int i = 0; i < parts.length; i++) {
                String part = parts[i];

                // Trailing separator.
                if (part.isEmpty() && i + 1 == parts.length) {
                    break;
                }

                if (rule.isTerm(part)) {
                    previous = part;
                    result.add(part);
                }
                else if (!PLACEHOLDER.equals(previous)) {
                    previous = PLACEHOLDER;
                    result.add(PLACEHOLDER);
                }
            }

            logger.trace("Normalizing {} because of rule: {}", path, rule);
            return new NormalizationResult(true, rule.getPrefix() + String.join(SEPARATOR, result));
        }

        return new NormalizationResult(false, path);
    }

    protected static List<TermRule> filterRules(JsonNode rawRules) {
        Map<String, TermRule> rulesByPrefix = new LinkedHashMap<>();

        for (JsonNode rawRule : rawRules) {
            JsonNode prefixNode = rawRule.get("prefix");
            if (prefixNode == null || !prefixNode.isTextual() || prefixNode.asText().isEmpty()) {
                logger.debug("Dropping segment terms rule without a usable prefix. rule={}", rawRule);
                continue;
            }

            String prefix = prefixNode.asText();
            if (!prefix.endsWith(SEPARATOR)) {
                prefix = prefix + SEPARATOR;
            }

            String[] prefixParts = prefix.split(SEPARATOR, -1);
            if (prefixParts.length != 3 || prefixParts[0].isEmpty() || prefixParts[1].isEmpty()) {
                logger.debug("Dropping segment terms rule whose prefix is not two path components. rule={}", rawRule);
                continue;
            }

            JsonNode termsNode = rawRule.get("terms");
            if (termsNode == null || !termsNode.isArray()) {
                logger.debug("Dropping segment terms rule whose terms are not an array. rule={}", rawRule);
                continue;
            }

            List<String> terms = new ArrayList<>(termsNode.size());
            for (JsonNode term : termsNode) {
                if (term.isTextual()) {
                    terms.add(term.asText());
                }
            }

            // A repeated prefix keeps its first position but takes the latest terms.
            rulesByPrefix.put(prefix, new TermRule(prefix, terms));
        }

        return Collections.unmodifiableList(new ArrayList<>(rulesByPrefix.values()));
    }
}
