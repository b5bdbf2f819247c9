package io.github.cyfko.proplogic.core.config;

/**
 * Complexity limits applied while tokenizing, parsing and tabulating formulas.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: Maximum character length of a formula (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum count of parentheses, negations and binary operators
 *       along any path of the formula tree (default: 256)</li>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct variables a truth table may enumerate (default: 20)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (for trusted batch jobs)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxVariables(16)
 *     .build();
 * }</pre>
 *
 * @param policyName       name reported in limit violations
 * @param maxFormulaLength maximum character length of a formula
 * @param maxNestingDepth  maximum nesting depth accepted by the parser, at most {@value #NESTING_CEILING}
 * @param maxVariables     maximum variable count of a truth table, at most {@value #VARIABLES_CEILING}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxNestingDepth,
    int maxVariables
) {

    /**
     * Upper bound of {@link #maxVariables()}: {@code 2^30} rows still index an {@code int}.
     */
    public static final int VARIABLES_CEILING = 30;

    /**
     * Upper bound of {@link #maxNestingDepth()}: parser, evaluator and formatter recurse once
     * per level and must stay within a default thread stack.
     */
    public static final int NESTING_CEILING = 1024;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNestingDepth <= 0 || maxNestingDepth > NESTING_CEILING) {
            throw new IllegalArgumentException(
                "maxNestingDepth must be in [1, " + NESTING_CEILING + "], got: " + maxNestingDepth);
        }
        if (maxVariables < 0 || maxVariables > VARIABLES_CEILING) {
            throw new IllegalArgumentException(
                "maxVariables must be in [0, " + VARIABLES_CEILING + "], got: " + maxVariables);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     *   <li>Max Variables: 20 (about one million rows)</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256, 20);
    }

    /**
     * Strict configuration for formulas typed by untrusted users.
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     *   <li>Max Variables: 12</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64, 12);
    }

    /**
     * Relaxed configuration for trusted batch processing.
     * <ul>
     *   <li>Max Formula Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 1024</li>
     *   <li>Max Variables: 24</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1024, 24);
    }

    /**
     * Creates a custom configuration. Builder values start from {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private int _maxNestingDepth = 256;
        private int _maxVariables = 20;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxNestingDepth, _maxVariables);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
