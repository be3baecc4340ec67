package io.github.cyfko.fetchql.core;

import java.util.Objects;

/**
 * Non-fatal remark about a successful transpilation: the SQL was produced, but part of the
 * FetchXML has no effect on it.
 *
 * @param code    what the warning is about
 * @param message human-readable explanation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TranspilationWarning(Code code, String message) {

    public enum Code {
        /** {@code page} or {@code paging-cookie} was declared; the SQL preview has no paging. */
        PAGING,
        /** {@code count} was declared; it caps the rows like {@code top}. */
        COUNT_AS_TOP,
        /** Aggregate columns are used but {@code <fetch>} lacks {@code aggregate="true"}. */
        AGGREGATE_NOT_DECLARED
    }

    public TranspilationWarning {
        Objects.requireNonNull(code, "Warning code is required");
        Objects.requireNonNull(message, "Warning message is required");
    }
}
