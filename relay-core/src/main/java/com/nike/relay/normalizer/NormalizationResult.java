package com.nike.relay.normalizer;

/**
 * The outcome of {@link SegmentTermsNormalizer#normalize(String)}: whether a rule matched, and the resulting name
 * (the original path when nothing matched).
 */
public class NormalizationResult {

    private final boolean matched;
    private final String value;

    public NormalizationResult(boolean matched, String value) {
        this.matched = matched;
        this.value = value;
    }

    public boolean isMatched() {
        return matched;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizationResult)) {
            return false;
        }
        NormalizationResult that = (NormalizationResult) o;
        return matched == that.matched && ((value == null) ? that.value == null : value.equals(that.value));
    }

    @Override
    public int hashCode() {
        return 31 * (matched ? 1 : 0) + ((value == null) ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        return "NormalizationResult{matched=" + matched + ", value='" + value + "'}";
    }
}
