package io.github.cyfko.fetchql.core.mapping;

import io.github.cyfko.fetchql.core.api.ConditionOperator;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Turns relative-date operators ({@code today}, {@code last-x-days}, ...) into concrete
 * instant ranges.
 * <p>
 * "Now" comes from the injected {@link Clock}; day, week, month and year boundaries are computed
 * in the given zone. Weeks start on Monday.
 * </p>
 * <ul>
 *   <li>{@code last-*} ranges run from the start of the day (of the hour for {@code last-x-hours})
 *       that many units back, up to now</li>
 *   <li>{@code next-*} ranges run from now to the end of the day (hour) that many units ahead</li>
 *   <li>calendar operators ({@code this-month}, {@code last-week}, ...) cover whole periods</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RelativeDateResolver {

    private final Clock clock;
    private final ZoneId zone;

    public RelativeDateResolver(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.zone = Objects.requireNonNull(zone, "Zone is required");
    }

    /**
     * Resolves a relative-date operator.
     *
     * @param operator an operator of category {@link ConditionOperator.Category#RELATIVE_DATE}
     * @param count    number of units for {@code last-x-*} / {@code next-x-*}, ignored otherwise
     * @return the covered range
     * @throws IllegalArgumentException if the operator is not a relative-date operator, or if
     *                                  it takes a count and {@code count} is not positive
     * @throws java.time.DateTimeException if the range ends outside the supported calendar
     */
    public DateRange resolve(ConditionOperator operator, int count) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        if (operator.category() != ConditionOperator.Category.RELATIVE_DATE) {
            throw new IllegalArgumentException("Not a relative-date operator: " + operator.code());
        }
        if (operator.takesUnitCount() && count <= 0) {
            throw new IllegalArgumentException("Operator '" + operator.code() + "' needs a positive count, got " + count);
        }

        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        LocalDate today = now.toLocalDate();

        return switch (operator) {
            case TODAY -> days(today, today.plusDays(1));
            case YESTERDAY -> days(today.minusDays(1), today);
            case TOMORROW -> days(today.plusDays(1), today.plusDays(2));
            case LAST_SEVEN_DAYS -> sinceDay(today.minusDays(7), now);
            case NEXT_SEVEN_DAYS -> untilDayEnd(now, today.plusDays(7));
            case THIS_WEEK -> {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield days(monday, monday.plusWeeks(1));
            }
            case LAST_WEEK -> {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield days(monday.minusWeeks(1), monday);
            }
            case THIS_MONTH -> {
                LocalDate first = today.withDayOfMonth(1);
                yield days(first, first.plusMonths(1));
            }
            case LAST_MONTH -> {
                LocalDate first = today.withDayOfMonth(1);
                yield days(first.minusMonths(1), first);
            }
            case THIS_YEAR -> {
                LocalDate first = today.withDayOfYear(1);
                yield days(first, first.plusYears(1));
            }
            case LAST_YEAR -> {
                LocalDate first = today.withDayOfYear(1);
                yield days(first.minusYears(1), first);
            }
            case LAST_X_HOURS -> new DateRange(
                    now.truncatedTo(ChronoUnit.HOURS).minusHours(count).toInstant(), now.toInstant());
            case NEXT_X_HOURS -> new DateRange(
                    now.toInstant(), now.truncatedTo(ChronoUnit.HOURS).plusHours(count + 1L).toInstant());
            case LAST_X_DAYS -> sinceDay(today.minusDays(count), now);
            case NEXT_X_DAYS -> untilDayEnd(now, today.plusDays(count));
            case LAST_X_WEEKS -> sinceDay(today.minusWeeks(count), now);
            case NEXT_X_WEEKS -> untilDayEnd(now, today.plusWeeks(count));
            case LAST_X_MONTHS -> sinceDay(today.minusMonths(count), now);
            case NEXT_X_MONTHS -> untilDayEnd(now, today.plusMonths(count));
            case LAST_X_YEARS -> sinceDay(today.minusYears(count), now);
            case NEXT_X_YEARS -> untilDayEnd(now, today.plusYears(count));
            default -> throw new IllegalArgumentException("Not a relative-date operator: " + operator.code());
        };
    }

    private DateRange days(LocalDate fromDay, LocalDate toDay) {
        return new DateRange(startOf(fromDay), startOf(toDay));
    }

    private DateRange sinceDay(LocalDate fromDay, ZonedDateTime now) {
        return new DateRange(startOf(fromDay), now.toInstant());
    }

    private DateRange untilDayEnd(ZonedDateTime now, LocalDate lastDay) {
        return new DateRange(now.toInstant(), startOf(lastDay.plusDays(1)));
    }

    private Instant startOf(LocalDate day) {
        return day.atStartOfDay(zone).toInstant();
    }
}
