package io.github.cyfko.fetchql.core.model;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.utils.OperatorArityUtils;

import java.util.List;
import java.util.Objects;

/**
 * A single comparison test of a filter group.
 * <p>
 * Values are kept as raw literal text; their SQL rendering (number, string, date)
 * is decided at generation time. The number of values always satisfies the arity
 * of the operator, and operators expecting a date or a unit count always hold one.
 * </p>
 *
 * @param attribute  the tested column, possibly qualified as {@code alias.column}
 * @param entityName alias of the link-entity the column belongs to, or {@code null}
 * @param operator   the comparison operator
 * @param values     the literal values, in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Condition(String attribute, String entityName, ConditionOperator operator, List<String> values)
        implements FilterNode {

    public Condition {
        Objects.requireNonNull(attribute, "Condition attribute is required");
        Objects.requireNonNull(operator, "Condition operator is required");
        if (attribute.isBlank()) {
            throw new IllegalArgumentException("attribute cannot be blank");
        }
        values = List.copyOf(values == null ? List.of() : values);
        OperatorArityUtils.Verdict verdict = OperatorArityUtils.validateValueCount(operator, values.size());
        if (verdict.isValid()) {
            verdict = OperatorArityUtils.validateLiterals(operator, values);
        }
        if (!verdict.isValid()) {
            throw new IllegalArgumentException(verdict.problem());
        }
    }

    public static Condition of(String attribute, ConditionOperator operator, String... values) {
        return new Condition(attribute, null, operator, List.of(values));
    }

    @Override
    public Kind kind() {
        return Kind.CONDITION;
    }
}
