package io.github.cyfko.fetchql.core.mapping;

import java.util.regex.Pattern;

/**
 * How a raw condition value is written into SQL.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LiteralKind {
    /** {@code -?\d+(\.\d+)?}, written unquoted. */
    NUMBER,
    /** {@code true} or {@code false}, written unquoted. */
    BOOLEAN,
    /** A date/time accepted by {@link CanonicalTime}, normalized then quoted. */
    DATE_TIME,
    /** Anything else, quoted with embedded quotes doubled. */
    STRING;

    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(\\.\\d+)?");

    /**
     * Infers the kind of a raw literal.
     *
     * @param raw the value as written in the source
     * @return the inferred kind, {@link #STRING} when nothing more specific applies
     */
    public static LiteralKind detect(String raw) {
        if (NUMBER_PATTERN.matcher(raw).matches()) {
            return NUMBER;
        }
        if ("true".equals(raw) || "false".equals(raw)) {
            return BOOLEAN;
        }
        if (CanonicalTime.isDateTime(raw)) {
            return DATE_TIME;
        }
        return STRING;
    }
}
