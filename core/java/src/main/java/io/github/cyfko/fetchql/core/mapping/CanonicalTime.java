package io.github.cyfko.fetchql.core.mapping;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point for date/time literals.
 * <p>
 * Every accepted notation is first normalized to an {@link Instant}; rendering then formats
 * that instant in one output zone. Two literals denoting the same instant therefore always
 * render identically, whatever notation they were written in.
 * </p>
 *
 * <p><strong>Accepted notations:</strong></p>
 * <ul>
 *   <li>{@code 2024-01-15} (start of day)</li>
 *   <li>{@code 2024-01-15T10:00}, {@code 2024-01-15T10:00:00}, {@code 2024-01-15T10:00:00.250}</li>
 *   <li>a space instead of {@code T}: {@code 2024-01-15 10:00:00}</li>
 *   <li>an offset: {@code Z}, {@code +02:00} or {@code +0200}</li>
 *   <li>the basic form {@code 20240115T100000Z}</li>
 * </ul>
 * Values without an offset are read in the source zone given by the caller.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CanonicalTime {

    private static final DateTimeFormatter EXTENDED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter BASIC = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter OUTPUT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX", Locale.ROOT);

    private CanonicalTime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Parses a date/time literal into the instant it denotes.
     *
     * @param raw        the literal as written
     * @param sourceZone zone applied to literals without an offset
     * @return the instant, or empty if {@code raw} is not a supported date/time notation
     */
    public static Optional<Instant> tryNormalize(String raw, ZoneId sourceZone) {
        Objects.requireNonNull(sourceZone, "Source zone is required");
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            TemporalAccessor parsed = (isBasicForm(text) ? BASIC : EXTENDED).parse(text);
            LocalDate date = LocalDate.from(parsed);
            if (!parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                return Optional.of(date.atStartOfDay(sourceZone).toInstant());
            }
            LocalDateTime dateTime = LocalDateTime.of(date, LocalTime.from(parsed));
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                ZoneOffset offset = ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS));
                return Optional.of(dateTime.toInstant(offset));
            }
            return Optional.of(dateTime.atZone(sourceZone).toInstant());
        } catch (DateTimeException notADate) {
            return Optional.empty();
        }
    }

    /**
     * Parses a date/time literal into the instant it denotes.
     *
     * @param raw        the literal as written
     * @param sourceZone zone applied to literals without an offset
     * @return the instant
     * @throws IllegalArgumentException if {@code raw} is not a supported date/time notation
     */
    public static Instant normalize(String raw, ZoneId sourceZone) {
        return tryNormalize(raw, sourceZone)
                .orElseThrow(() -> new IllegalArgumentException("Not a date/time literal: '" + raw + "'"));
    }

    public static boolean isDateTime(String raw) {
        return tryNormalize(raw, ZoneOffset.UTC).isPresent();
    }

    /**
     * Formats an instant as {@code yyyy-MM-dd'T'HH:mm:ss} followed by the offset of {@code zone}
     * ({@code Z} for UTC). Sub-second precision is dropped.
     *
     * @param instant the instant to print
     * @param zone    the output zone
     * @return the canonical text, unquoted
     */
    public static String format(Instant instant, ZoneId zone) {
        return OUTPUT.format(instant.atZone(zone));
    }

    private static boolean isBasicForm(String text) {
        if (text.length() < 9 || text.charAt(8) != 'T') {
            return false;
        }
        for (int i = 0; i < 8; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
