package io.github.cyfko.fetchql.core.exception;

import io.github.cyfko.fetchql.core.parsing.SourcePosition;

import java.util.Objects;

/**
 * Exception thrown by the tokenizer when the raw text is not well-formed markup.
 * <p>
 * Tokenizing is fatal on the first error: no partial token stream is ever returned.
 * </p>
 *
 * <p><strong>Error examples:</strong></p>
 * <pre>{@code
 * tokenizer.tokenize("<fetch top=\"5>");
 * // → UNTERMINATED_QUOTE: "Attribute value is not terminated at line 1, column 12"
 *
 * tokenizer.tokenize("<value>&nbsp;</value>");
 * // → INVALID_CHARACTER_REFERENCE: "Unknown entity reference '&nbsp;' at line 1, column 8"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TokenizeException extends FetchXmlParseException {

    /**
     * Discriminant of a tokenizing failure.
     */
    public enum Reason {
        EMPTY_INPUT,
        INPUT_TOO_LONG,
        UNTERMINATED_TAG,
        UNTERMINATED_QUOTE,
        UNQUOTED_ATTRIBUTE,
        MALFORMED_TAG,
        DUPLICATE_ATTRIBUTE,
        INVALID_CHARACTER_REFERENCE,
        UNTERMINATED_COMMENT,
        UNTERMINATED_CDATA,
        UNSUPPORTED_MARKUP
    }

    private final Reason reason;

    public TokenizeException(Reason reason, String message, SourcePosition position) {
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
