package com.nike.relay.normalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated segment terms rule: a two component {@link #getPrefix() prefix} ending with {@code /}, and the
 * allow-listed path components that survive normalization under that prefix. Instances are immutable. Raw rules are
 * validated by {@link SegmentTermsNormalizer#load(com.fasterxml.jackson.databind.JsonNode)}.
 */
public class TermRule {

    private final String prefix;
    private final Set<String> terms;

    public TermRule(String prefix, List<String> terms) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }

        this.prefix = prefix;
        this.terms = (terms == null)
                     ? Collections.<String>emptySet()
                     : Collections.unmodifiableSet(new LinkedHashSet<>(terms));
    }

    public String getPrefix() {
        return prefix;
    }

    public Set<String> getTerms() {
        return terms;
    }

    public boolean isTerm(String pathComponent) {
        return terms.contains(pathComponent);
    }

    public boolean appliesTo(String path) {
        return path != null && path.startsWith(prefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TermRule)) {
            return false;
        }
        TermRule termRule = (TermRule) o;
        return prefix.equals(termRule.prefix) && terms.equals(termRule.terms);
    }

    @Override
    public int hashCode() {
        return 31 * prefix.hashCode() + terms.hashCode();
    }

    @Override
    public String toString() {
        return "TermRule{prefix='" + prefix + "', terms=" + new ArrayList<>(terms) + "}";
    }
}
