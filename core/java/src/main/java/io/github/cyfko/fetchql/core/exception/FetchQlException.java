package io.github.cyfko.fetchql.core.exception;

/**
 * Root of every error raised while transpiling FetchXML to SQL.
 * <p>
 * Each stage of the pipeline fails fast with exactly one subclass of this exception.
 * All of them are deterministic functions of the input: retrying the same call
 * always produces the same error.
 * </p>
 *
 * <pre>
 * FetchQlException
 *  ├─ FetchXmlParseException   (carries a source position)
 *  │   ├─ TokenizeException
 *  │   ├─ StructuralException
 *  │   └─ SemanticException
 *  └─ GenerationException
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class FetchQlException extends RuntimeException {

    protected FetchQlException(String message) {
        super(message);
    }

    protected FetchQlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the discriminant of this error, i.e. the name of its {@code Reason} constant.
     *
     * @return the reason code, never {@code null}
     */
    public abstract String reasonCode();
}
