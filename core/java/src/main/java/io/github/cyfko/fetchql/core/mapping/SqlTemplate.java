package io.github.cyfko.fetchql.core.mapping;

import io.github.cyfko.fetchql.core.api.ConditionOperator;

import java.util.Objects;

/**
 * SQL rendering rule of one condition operator.
 *
 * @param operator the FetchXML operator
 * @param shape    the fragment layout
 * @param keyword  the SQL operator or keyword placed after the column, e.g. {@code "<>"},
 *                 {@code "NOT LIKE"} or {@code "IS NULL"}; empty for date shapes
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SqlTemplate(ConditionOperator operator, Shape shape, String keyword) {

    /**
     * Fragment layouts, {@code c} being the column and {@code v} the rendered values.
     */
    public enum Shape {
        /** {@code c OP v} */
        BINARY,
        /** {@code c LIKE v}, the pattern as written */
        PATTERN,
        /** {@code c LIKE 'v%'}, wildcards in v escaped */
        PREFIX_PATTERN,
        /** {@code c LIKE '%v'}, wildcards in v escaped */
        SUFFIX_PATTERN,
        /** {@code c IS NULL} */
        POSTFIX,
        /** {@code c IN (v1, v2, ...)} */
        LIST,
        /** {@code c BETWEEN v1 AND v2} */
        RANGE,
        /** {@code (c >= 'day' AND c < 'day+1')} */
        WHOLE_DAY,
        /** {@code c < 'day+1'} */
        UNTIL_DAY_END,
        /** {@code c >= 'day'} */
        FROM_DAY_START,
        /** {@code (c >= 'from' AND c < 'to')}, bounds computed from the clock */
        RELATIVE_RANGE
    }

    public SqlTemplate {
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(shape, "shape is required");
        Objects.requireNonNull(keyword, "keyword is required");
    }
}
