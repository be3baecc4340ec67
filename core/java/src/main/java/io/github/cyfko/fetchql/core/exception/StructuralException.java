package io.github.cyfko.fetchql.core.exception;

import io.github.cyfko.fetchql.core.parsing.SourcePosition;

import java.util.Objects;

/**
 * Exception thrown when the token stream does not form a single, properly nested tag tree.
 *
 * <p><strong>Error examples:</strong></p>
 * <pre>{@code
 * // <fetch><entity name="contact"></fetch>
 * // → MISMATCHED_TAG: "Expected </entity> but found </fetch> at line 1, column 31"
 *
 * // <fetch><entity name="contact">
 * // → UNTERMINATED_TAG: "Unterminated tag <entity> (still open: <fetch>, <entity>) at line 1, column 8"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StructuralException extends FetchXmlParseException {

    /**
     * Discriminant of a tree-building failure.
     */
    public enum Reason {
        MISMATCHED_TAG,
        UNTERMINATED_TAG,
        UNEXPECTED_CLOSE_TAG,
        MULTIPLE_ROOTS,
        TEXT_OUTSIDE_ROOT,
        EMPTY_DOCUMENT,
        NESTING_TOO_DEEP
    }

    private final Reason reason;

    public StructuralException(Reason reason, String message, SourcePosition position) {
        super(message, position);
        this.reason = Objects.requireNonNull(reason, "reason is required");
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String reasonCode() {
        return reason.name();
    }
}
