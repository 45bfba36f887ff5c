package io.eventmatch.core.config;

/**
 * Tuning options for rule evaluation. Immutable and thread-safe.
 *
 * @param heterogeneousNumericComparisons allow comparing int, uint and double operands with each
 *                                        other (default: true)
 * @param programCacheSize                maximum number of compiled expressions kept across calls;
 *                                        0 disables the cache (default: 0)
 * @param maxExpressionLength             longest accepted expression, in characters (default:
 *                                        100 000)
 */
public record EvaluatorOptions(
        boolean heterogeneousNumericComparisons, int programCacheSize, int maxExpressionLength) {

    /** Default options: heterogeneous comparisons on, no program cache, 100 000 characters. */
    public static final EvaluatorOptions DEFAULT = new EvaluatorOptions(true, 0, 100_000);

    public EvaluatorOptions {
        if (programCacheSize < 0) {
            throw new IllegalArgumentException("programCacheSize must not be negative, got: " + programCacheSize);
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
    }

    public EvaluatorOptions withHeterogeneousNumericComparisons(boolean enabled) {
        return new EvaluatorOptions(enabled, programCacheSize, maxExpressionLength);
    }

    public EvaluatorOptions withProgramCacheSize(int size) {
        return new EvaluatorOptions(heterogeneousNumericComparisons, size, maxExpressionLength);
    }

    public EvaluatorOptions withMaxExpressionLength(int length) {
        return new EvaluatorOptions(heterogeneousNumericComparisons, programCacheSize, length);
    }

    /** Returns {@code true} if compiled expressions are cached across calls. */
    public boolean programCacheEnabled() {
        return programCacheSize > 0;
    }
}
