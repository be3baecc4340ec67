package io.github.cyfko.fetchql.core.mapping;

import io.github.cyfko.fetchql.core.config.GeneratorConfig;

import java.time.Instant;
import java.util.Objects;

/**
 * Renders raw condition values as SQL literals.
 * <p>
 * Pure and stateless apart from its configuration; safe to share between threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueMapper {

    private final GeneratorConfig config;

    public ValueMapper(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "Generator config is required");
    }

    /**
     * Renders {@code raw} according to its detected {@link LiteralKind}.
     *
     * @param raw the value as written in the source
     * @return the SQL literal
     */
    public String mapValue(String raw) {
        return mapValue(raw, LiteralKind.detect(raw));
    }

    /**
     * Renders {@code raw} as a literal of the given kind.
     *
     * @param raw  the value as written in the source
     * @param kind how to render it
     * @return the SQL literal
     * @throws IllegalArgumentException if {@code kind} is {@link LiteralKind#DATE_TIME} and
     *                                  {@code raw} is not a date
     */
    public String mapValue(String raw, LiteralKind kind) {
        Objects.requireNonNull(raw, "Value cannot be null");
        return switch (kind) {
            case NUMBER, BOOLEAN -> raw;
            case DATE_TIME -> mapInstant(CanonicalTime.normalize(raw, config.getSourceZone()));
            case STRING -> quote(raw);
        };
    }

    public String mapInstant(Instant instant) {
        return quote(CanonicalTime.format(instant, config.getOutputZone()));
    }

    /**
     * Renders a {@code LIKE} pattern. The wildcards {@code %}, {@code _} and {@code [} inside
     * {@code raw} are escaped as {@code [%]}, {@code [_]} and {@code [[]} so they match
     * literally, then the requested leading and trailing {@code %} are added.
     *
     * @param raw            the text to match
     * @param leadingPercent whether the pattern may start with anything
     * @param trailingPercent whether the pattern may end with anything
     * @return the quoted pattern
     */
    public String mapPattern(String raw, boolean leadingPercent, boolean trailingPercent) {
        StringBuilder pattern = new StringBuilder(raw.length() + 4);
        if (leadingPercent) pattern.append('%');
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '%' -> pattern.append("[%]");
                case '_' -> pattern.append("[_]");
                case '[' -> pattern.append("[[]");
                default -> pattern.append(c);
            }
        }
        if (trailingPercent) pattern.append('%');
        return quote(pattern.toString());
    }

    /**
     * Wraps text in single quotes, doubling the quotes it contains.
     *
     * @param text the text
     * @return the quoted SQL string
     */
    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
