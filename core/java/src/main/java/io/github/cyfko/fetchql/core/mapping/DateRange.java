package io.github.cyfko.fetchql.core.mapping;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [from, to)} of instants.
 *
 * @param from inclusive lower bound
 * @param to   exclusive upper bound
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DateRange(Instant from, Instant to) {

    public DateRange {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before its start " + from);
        }
    }
}
