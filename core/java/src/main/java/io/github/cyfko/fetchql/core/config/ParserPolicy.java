package io.github.cyfko.fetchql.core.config;

/**
 * Limits and strictness switches applied while parsing FetchXML.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxInputLength</strong>: maximum number of characters of the source text</li>
 *   <li><strong>maxNestingDepth</strong>: maximum element nesting depth</li>
 *   <li><strong>requireFilterType</strong>: whether {@code <filter>} must spell out its {@code type};
 *       when {@code false} a missing type means {@code and}, as on the data service</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (editor buffers)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (every filter states its combinator, smaller limits)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (generated or trusted queries)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxNestingDepth(64)
 *     .build();
 * }</pre>
 *
 * @param policyName        name reported in limit errors
 * @param maxInputLength    maximum character length of the source text
 * @param maxNestingDepth   maximum element nesting depth
 * @param requireFilterType whether the {@code type} attribute of {@code <filter>} is mandatory
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxInputLength,
        int maxNestingDepth,
        boolean requireFilterType
) {

    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Input Length: 1,000,000 characters</li>
     *   <li>Max Nesting Depth: 1000 elements</li>
     *   <li>Filter type: optional, defaults to {@code and}</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 1_000_000, 1000, false);
    }

    /**
     * Strict configuration.
     * <ul>
     *   <li>Max Input Length: 100,000 characters</li>
     *   <li>Max Nesting Depth: 128 elements</li>
     *   <li>Filter type: required</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 100_000, 128, true);
    }

    /**
     * Relaxed configuration.
     * <ul>
     *   <li>Max Input Length: 10,000,000 characters</li>
     *   <li>Max Nesting Depth: 4000 elements</li>
     *   <li>Filter type: optional, defaults to {@code and}</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10_000_000, 4000, false);
    }

    /**
     * Creates a custom configuration, initialized with the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxInputLength = 1_000_000;
        private int _maxNestingDepth = 1000;
        private boolean _requireFilterType = false;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxInputLength, _maxNestingDepth, _requireFilterType);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxInputLength(int maxInputLength) { this._maxInputLength = maxInputLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder requireFilterType(boolean requireFilterType) { this._requireFilterType = requireFilterType; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
