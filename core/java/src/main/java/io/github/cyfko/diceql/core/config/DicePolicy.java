package io.github.cyfko.diceql.core.config;

/**
 * Complexity limits applied while parsing roll expressions.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the trimmed expression</li>
 *   <li><strong>maxDiceCount</strong>: Maximum number of dice rolled once multi-die terms are expanded</li>
 *   <li><strong>maxFaceCount</strong>: Maximum face count of a single die</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for interactive use)
 * DicePolicy policy = DicePolicy.defaults();
 *
 * // Strict (for untrusted input, e.g. chat bots)
 * DicePolicy policy = DicePolicy.strict();
 *
 * // Relaxed (for simulations)
 * DicePolicy policy = DicePolicy.relaxed();
 *
 * // Custom
 * DicePolicy policy = DicePolicy.builder()
 *     .maxDiceCount(50)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of expression string
 * @param maxDiceCount        maximum number of single dice in one expression
 * @param maxFaceCount        maximum face count of one die
 * @since 1.0.0
 */
public record DicePolicy(
    String policyName,
    int maxExpressionLength,
    int maxDiceCount,
    int maxFaceCount
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or any limit is not positive
     */
    public DicePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxDiceCount <= 0) {
            throw new IllegalArgumentException("maxDiceCount must be positive, got: " + maxDiceCount);
        }
        if (maxFaceCount <= 0) {
            throw new IllegalArgumentException("maxFaceCount must be positive, got: " + maxFaceCount);
        }
    }

    /**
     * Default configuration for interactive use.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Dice Count: 1000</li>
     *   <li>Max Face Count: 1000000</li>
     * </ul>
     *
     * @return default configuration
     */
    public static DicePolicy defaults() {
        return new DicePolicy(PolicyName.DEFAULT_POLICY.name(), 1000, 1000, 1_000_000);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 200 characters</li>
     *   <li>Max Dice Count: 100</li>
     *   <li>Max Face Count: 1000</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static DicePolicy strict() {
        return new DicePolicy(PolicyName.STRICT_POLICY.name(), 200, 100, 1000);
    }

    /**
     * Relaxed configuration for trusted batch simulations.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Dice Count: 100000</li>
     *   <li>Max Face Count: unbounded</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static DicePolicy relaxed() {
        return new DicePolicy(PolicyName.RELAXED_POLICY.name(), 10000, 100_000, Integer.MAX_VALUE);
    }

    /**
     * Resolves a preset from its short name ({@code DEFAULT}, {@code STRICT}, {@code RELAXED}),
     * ignoring case. The full enum names ({@code STRICT_POLICY}...) are accepted too.
     *
     * @param name the preset name
     * @return the matching preset
     * @throws IllegalArgumentException if no preset has that name
     */
    public static DicePolicy named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        String normalized = name.trim().toUpperCase();
        if (!normalized.endsWith("_POLICY")) {
            normalized = normalized + "_POLICY";
        }
        return switch (normalized) {
            case "DEFAULT_POLICY" -> defaults();
            case "STRICT_POLICY" -> strict();
            case "RELAXED_POLICY" -> relaxed();
            default -> throw new IllegalArgumentException("Unknown dice policy: " + name);
        };
    }

    /**
     * Creates a custom configuration with full control over all parameters.
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
        private int _maxExpressionLength = 1000;
        private int _maxDiceCount = 1000;
        private int _maxFaceCount = 1_000_000;

        private Builder() {}

        public DicePolicy build() {
            return new DicePolicy(_policyName, _maxExpressionLength, _maxDiceCount, _maxFaceCount);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxDiceCount(int maxDiceCount) { this._maxDiceCount = maxDiceCount; return this; }
        public Builder maxFaceCount(int maxFaceCount) { this._maxFaceCount = maxFaceCount; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
