package io.github.cyfko.fetchql.core.config;

/**
 * How the result cap of a query is written in SQL.
 */
public enum LimitStyle {
    /** {@code SELECT TOP 10 ...}, the dialect of the data service's SQL endpoint. */
    TOP,
    /** {@code ... LIMIT 10} at the end of the statement. */
    LIMIT
}
