package io.github.cyfko.fetchql.core.exception;

import io.github.cyfko.fetchql.core.api.QueryParser;
import io.github.cyfko.fetchql.core.parsing.SourcePosition;

import java.util.Objects;

/**
 * Exception thrown when FetchXML text cannot be turned into a query document.
 * <p>
 * The subclass tells which stage rejected the input:
 * </p>
 * <ul>
 *   <li>{@link TokenizeException}: malformed lexical structure (unterminated tag or quote, bad escape)</li>
 *   <li>{@link StructuralException}: tag nesting violations (mismatched close, unterminated open)</li>
 *   <li>{@link SemanticException}: the tree is well formed but is not a valid query
 *       (unknown element, arity mismatch, unknown operator, duplicate alias)</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     QueryDocument document = parser.parse(editorText);
 * } catch (FetchXmlParseException e) {
 *     // e.getMessage() already contains "line L, column C"
 *     highlight(e.position().offset());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryParser
 */
public abstract class FetchXmlParseException extends FetchQlException {

    private final transient SourcePosition position;

    protected FetchXmlParseException(String message, SourcePosition position) {
        super(message + " at " + Objects.requireNonNull(position, "position is required"));
        this.position = position;
    }

    /**
     * Returns where in the source text the problem was detected.
     *
     * @return the source position, never {@code null}
     */
    public SourcePosition position() {
        return position;
    }
}
