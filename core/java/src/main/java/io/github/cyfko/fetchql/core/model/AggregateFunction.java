package io.github.cyfko.fetchql.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggregate applied to a selected column.
 * <p>
 * {@link #COUNT} counts rows ({@code COUNT(*)}) whatever the column it is declared on;
 * {@link #COUNT_COLUMN} counts non-null values of that column.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum AggregateFunction {
    COUNT("count", "COUNT"),
    COUNT_COLUMN("countcolumn", "COUNT"),
    SUM("sum", "SUM"),
    AVG("avg", "AVG"),
    MIN("min", "MIN"),
    MAX("max", "MAX");

    private final String code;
    private final String sqlFunction;

    AggregateFunction(String code, String sqlFunction) {
        this.code = code;
        this.sqlFunction = sqlFunction;
    }

    public String code() {
        return code;
    }

    public String sqlFunction() {
        return sqlFunction;
    }

    public static Optional<AggregateFunction> fromCode(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AggregateFunction function : values()) {
            if (function.code.equals(normalized)) return Optional.of(function);
        }
        return Optional.empty();
    }
}
