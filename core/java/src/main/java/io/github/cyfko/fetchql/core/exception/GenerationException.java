package io.github.cyfko.fetchql.core.exception;

import io.github.cyfko.fetchql.core.api.QueryGenerator;

import java.util.Objects;

/**
 * Exception thrown when a query document cannot be rendered as SQL.
 * <p>
 * The document itself is valid FetchXML, but it either references a name that nothing in the
 * query declares, combines constructs that have no SQL equivalent, or asks for a date beyond
 * the supported calendar range.
 * The {@link #context()} names the part of the document being rendered, for example
 * {@code "entity[contact]/order"} or {@code "link-entity[acc]/filter"}.
 * </p>
 *
 * <p><strong>Error examples:</strong></p>
 * <pre>{@code
 * // <condition entityname="missing" attribute="name" operator="eq" value="x"/>
 * // → UNRESOLVED_REFERENCE: "Entity alias 'missing' does not match any link-entity (entity[contact]/filter)"
 *
 * // <all-attributes/> together with <attribute name="x" aggregate="count"/>
 * // → UNSUPPORTED_COMBINATION: "Aggregate columns cannot be combined with all-attributes (entity[contact])"
 *
 * // <condition attribute="d" operator="last-x-years" value="2000000000"/>
 * // → VALUE_OUT_OF_RANGE: "Condition 'last-x-years' on 'd' yields a date outside the supported range (entity[t]/filter)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryGenerator
 */
public class GenerationException extends FetchQlException {

    /**
     * Discriminant of a model-to-text failure.
     */
    public enum Reason {
        UNRESOLVED_REFERENCE,
        UNSUPPORTED_COMBINATION,
        VALUE_OUT_OF_RANGE
    }

    private final Reason reason;
    private final String context;

    public GenerationException(Reason reason, String message, String context) {
        this(reason, message, context, null);
    }

    public GenerationException(Reason reason, String message, String context, Throwable cause) {
        super(message + " (" + Objects.requireNonNull(context, "context is required") + ")", cause);
        this.reason = Objects.requireNonNull(reason, "reason is required");
        this.context = context;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the path of the document part that failed to render.
     *
     * @return the rendering context
     */
    public String context() {
        return context;
    }

    @Override
    public String reasonCode() {
        return reason.name();
    }
}
