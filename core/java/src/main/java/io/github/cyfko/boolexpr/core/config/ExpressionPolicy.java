package io.github.cyfko.boolexpr.core.config;

/**
 * Configuration of the expression pipeline: input limits and tokenizer behaviour.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum number of open groups and negations enclosing any
 *       point of the expression (default: 256)</li>
 *   <li><strong>strictKeywordBoundaries</strong>: Accept {@code true}/{@code false} only when not glued
 *       to a lowercase letter (default: enabled)</li>
 *   <li><strong>largeTableThreshold</strong>: Variable count from which a truth table request is logged
 *       as expensive (default: 18, i.e. 262144 rows)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ExpressionPolicy policy = ExpressionPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * ExpressionPolicy policy = ExpressionPolicy.strict();
 *
 * // Greedy keyword matching, "truex" reads as true followed by x
 * ExpressionPolicy policy = ExpressionPolicy.legacy();
 *
 * // Custom
 * ExpressionPolicy policy = ExpressionPolicy.builder()
 *     .maxExpressionLength(200)
 *     .maxNestingDepth(32)
 *     .largeTableThreshold(12)
 *     .build();
 * }</pre>
 *
 * @param policyName              name reported in diagnostics and logs
 * @param maxExpressionLength     maximum character length of expression string
 * @param maxNestingDepth         maximum combined depth of {@code (} and {@code !} prefixes
 * @param strictKeywordBoundaries whether keywords require a non-letter on both sides
 * @param largeTableThreshold     variable count from which truth tables are considered expensive
 * @since 1.0
 */
public record ExpressionPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth,
    boolean strictKeywordBoundaries,
    int largeTableThreshold
) {

    /**
     * Number of distinct identifiers the grammar can express ({@code a} to {@code z}).
     */
    public static final int MAX_VARIABLES = 26;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public ExpressionPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (largeTableThreshold < 0 || largeTableThreshold > MAX_VARIABLES) {
            throw new IllegalArgumentException(
                    "largeTableThreshold must be between 0 and " + MAX_VARIABLES + ", got: " + largeTableThreshold);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     *   <li>Keyword Boundaries: strict</li>
     *   <li>Large Table Threshold: 18 variables</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ExpressionPolicy defaults() {
        return new ExpressionPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256, true, 18);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     *   <li>Keyword Boundaries: strict</li>
     *   <li>Large Table Threshold: 16 variables</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ExpressionPolicy strict() {
        return new ExpressionPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64, true, 16);
    }

    /**
     * Relaxed configuration for trusted batch use.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 512</li>
     *   <li>Keyword Boundaries: strict</li>
     *   <li>Large Table Threshold: 22 variables</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ExpressionPolicy relaxed() {
        return new ExpressionPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 512, true, 22);
    }

    /**
     * Configuration reproducing the historical greedy keyword match, where {@code "truex"}
     * scans as {@code true} followed by {@code x}.
     *
     * @return legacy configuration
     */
    public static ExpressionPolicy legacy() {
        return new ExpressionPolicy(PolicyName.LEGACY_POLICY.name(), 5000, 256, false, 18);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are default initialized exactly as if created with the default mode.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 256;
        private boolean _strictKeywordBoundaries = true;
        private int _largeTableThreshold = 18;

        private Builder() {}

        public ExpressionPolicy build() {
            return new ExpressionPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _strictKeywordBoundaries, _largeTableThreshold);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder strictKeywordBoundaries(boolean strict) { this._strictKeywordBoundaries = strict; return this; }
        public Builder largeTableThreshold(int threshold) { this._largeTableThreshold = threshold; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        LEGACY_POLICY,
        CUSTOM_POLICY
    }
}
