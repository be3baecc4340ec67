package io.github.cyfko.fetchql.core.exception;

import io.github.cyfko.fetchql.core.parsing.SourcePosition;

import java.util.Objects;

/**
 * Exception thrown when a well-formed tag tree does not describe a valid FetchXML query.
 * <p>
 * Raised while walking the tag tree into the query model, before any SQL is produced.
 * </p>
 *
 * <p><strong>Error examples:</strong></p>
 * <pre>{@code
 * // <condition attribute="email" operator="null" value="x"/>
 * // → ARITY_MISMATCH: "Operator 'null' takes no value, got 1"
 *
 * // <condition attribute="name" operator="sounds-like" value="x"/>
 * // → UNKNOWN_OPERATOR: "Unknown condition operator 'sounds-like'"
 *
 * // two <link-entity alias="acc"> in one query
 * // → DUPLICATE_ALIAS: "Alias 'acc' is declared more than once"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SemanticException extends FetchXmlParseException {

    /**
     * Discriminant of a tree-to-model failure.
     */
    public enum Reason {
        UNKNOWN_ELEMENT,
        MISSING_ELEMENT,
        MISSING_ATTRIBUTE,
        INVALID_ATTRIBUTE_VALUE,
        CONFLICTING_ATTRIBUTES,
        UNEXPECTED_TEXT,
        EMPTY_FILTER,
        UNKNOWN_OPERATOR,
        ARITY_MISMATCH,
        INVALID_LITERAL,
        DUPLICATE_ALIAS
    }

    private final Reason reason;

    public SemanticException(Reason reason, String message, SourcePosition position) {
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
