package io.github.cyfko.fetchql.core.utils;

import io.github.cyfko.fetchql.core.api.Arity;
import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.mapping.CanonicalTime;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Static checks of the literal values attached to a condition operator.
 * <p>
 * Centralizes the rules shared by the parser and by hand-built documents:
 * </p>
 * <ul>
 *     <li>the number of values must satisfy the operator {@link Arity}</li>
 *     <li>{@code last-x-*} / {@code next-x-*} operators take a positive whole count</li>
 *     <li>{@code on}, {@code on-or-before} and {@code on-or-after} take a date</li>
 * </ul>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorArityUtils {

    private OperatorArityUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Outcome of a check: accepted, or rejected with the reason.
     *
     * @param problem why the values were rejected, {@code null} when accepted
     */
    public record Verdict(String problem) {

        private static final Verdict ACCEPTED = new Verdict(null);

        public static Verdict accepted() {
            return ACCEPTED;
        }

        public static Verdict rejected(String problem) {
            return new Verdict(Objects.requireNonNull(problem, "A rejection needs a reason"));
        }

        public boolean isValid() {
            return problem == null;
        }
    }

    /**
     * Checks that {@code count} values are acceptable for {@code operator}.
     *
     * @param operator the condition operator
     * @param count    number of values supplied
     * @return the verdict
     * @throws NullPointerException if operator is null
     */
    public static Verdict validateValueCount(ConditionOperator operator, int count) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Arity arity = operator.arity();
        if (arity.accepts(count)) {
            return Verdict.accepted();
        }
        if (arity == Arity.NONE) {
            return Verdict.rejected(String.format(
                    "Operator '%s' takes no value, got %d", operator.code(), count));
        }
        return Verdict.rejected(String.format(
                "Operator '%s' requires %s, got %d", operator.code(), arity.describe(), count));
    }

    /**
     * Checks the content of the values of operators that expect a specific literal kind.
     * Other operators accept any text.
     *
     * @param operator the condition operator
     * @param values   the raw values, already accepted by {@link #validateValueCount}
     * @return the verdict
     */
    public static Verdict validateLiterals(ConditionOperator operator, List<String> values) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");

        if (operator.takesUnitCount()) {
            String raw = values.get(0).trim();
            if (!isPositiveInteger(raw)) {
                return Verdict.rejected(String.format(
                        "Operator '%s' requires a positive whole number, got '%s'", operator.code(), raw));
            }
        } else if (operator.category() == ConditionOperator.Category.DATE) {
            String raw = values.get(0);
            // zone only matters for the instant, not for whether the text is a date
            if (CanonicalTime.tryNormalize(raw, ZoneOffset.UTC).isEmpty()) {
                return Verdict.rejected(String.format(
                        "Operator '%s' requires a date, got '%s'", operator.code(), raw));
            }
        }
        return Verdict.accepted();
    }

    /**
     * Returns whether {@code text} is a whole number in {@code 1..Integer.MAX_VALUE}.
     *
     * @param text the text to test
     * @return {@code true} if positive and within int range
     */
    public static boolean isPositiveInteger(String text) {
        if (text == null || text.isEmpty() || text.length() > 10) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        long value = Long.parseLong(text);
        return value > 0 && value <= Integer.MAX_VALUE;
    }
}
