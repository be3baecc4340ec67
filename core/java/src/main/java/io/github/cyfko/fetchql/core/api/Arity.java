package io.github.cyfko.fetchql.core.api;

/**
 * Number of literal values a {@link ConditionOperator} consumes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Arity {

    /** No value: null checks and fixed relative dates such as {@code today}. */
    NONE(0, 0),

    /** Exactly one value: comparisons, patterns, {@code last-x-days}. */
    ONE(1, 1),

    /** Exactly two values: {@code between}. */
    TWO(2, 2),

    /** At least one value: set membership. */
    ONE_OR_MORE(1, Integer.MAX_VALUE);

    private final int min;
    private final int max;

    Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    /**
     * Checks whether {@code count} values satisfy this arity.
     *
     * @param count number of supplied values
     * @return {@code true} if the count is within bounds
     */
    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    /**
     * Human-readable requirement, e.g. "exactly 2 values" or "at least 1 value".
     *
     * @return the description used in error messages
     */
    public String describe() {
        return switch (this) {
            case NONE -> "no value";
            case ONE -> "exactly 1 value";
            case TWO -> "exactly 2 values";
            case ONE_OR_MORE -> "at least 1 value";
        };
    }
}
