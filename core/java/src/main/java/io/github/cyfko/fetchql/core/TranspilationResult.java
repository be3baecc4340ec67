package io.github.cyfko.fetchql.core;

import io.github.cyfko.fetchql.core.exception.FetchQlException;
import io.github.cyfko.fetchql.core.exception.FetchXmlParseException;
import io.github.cyfko.fetchql.core.parsing.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Transpiler#transpile(String)}: either SQL text, or a description of the
 * first error.
 * <p>
 * On success {@code sql} is set and the error fields are {@code null}. On failure {@code sql}
 * is {@code null}, {@code errorMessage} and {@code errorReason} are set, and
 * {@code errorPosition} is set when the error was detected while parsing.
 * </p>
 *
 * @param success       whether SQL was produced
 * @param sql           the generated SQL, or {@code null}
 * @param warnings      non-fatal remarks, empty on failure
 * @param errorMessage  message of the error, or {@code null}
 * @param errorReason   reason code of the error, e.g. {@code "UNTERMINATED_TAG"}, or {@code null}
 * @param errorPosition where the error was detected in the source, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TranspilationResult(
        boolean success,
        String sql,
        List<TranspilationWarning> warnings,
        String errorMessage,
        String errorReason,
        SourcePosition errorPosition
) {

    public TranspilationResult {
        warnings = List.copyOf(warnings == null ? List.of() : warnings);
        if (success && sql == null) {
            throw new IllegalArgumentException("A successful result needs SQL text");
        }
        if (!success && errorMessage == null) {
            throw new IllegalArgumentException("A failed result needs an error message");
        }
    }

    public static TranspilationResult succeeded(String sql, List<TranspilationWarning> warnings) {
        return new TranspilationResult(true, Objects.requireNonNull(sql, "sql is required"), warnings,
                null, null, null);
    }

    /**
     * Builds the failed result describing {@code error}.
     *
     * @param error the error that stopped the pipeline
     * @return a failed result
     */
    public static TranspilationResult failed(FetchQlException error) {
        Objects.requireNonNull(error, "error is required");
        SourcePosition position = error instanceof FetchXmlParseException parseError ? parseError.position() : null;
        return new TranspilationResult(false, null, List.of(), error.getMessage(), error.reasonCode(), position);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
