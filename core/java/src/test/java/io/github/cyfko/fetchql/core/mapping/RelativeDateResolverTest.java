package io.github.cyfko.fetchql.core.mapping;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RelativeDateResolver Tests")
class RelativeDateResolverTest {

    private static RelativeDateResolver at(String instant) {
        return new RelativeDateResolver(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private static DateRange range(String from, String to) {
        return new DateRange(Instant.parse(from), Instant.parse(to));
    }

    @Test
    @DisplayName("Should start the week on Monday when today is Sunday")
    void shouldHandleSunday() {
        RelativeDateResolver sunday = at("2024-03-17T09:00:00Z");

        assertEquals(range("2024-03-11T00:00:00Z", "2024-03-18T00:00:00Z"),
                sunday.resolve(ConditionOperator.THIS_WEEK, 0));
        assertEquals(range("2024-03-04T00:00:00Z", "2024-03-11T00:00:00Z"),
                sunday.resolve(ConditionOperator.LAST_WEEK, 0));
    }

    @Test
    @DisplayName("Should start a new week on Monday")
    void shouldHandleMonday() {
        RelativeDateResolver monday = at("2024-03-18T00:00:00Z");

        assertEquals(range("2024-03-18T00:00:00Z", "2024-03-25T00:00:00Z"),
                monday.resolve(ConditionOperator.THIS_WEEK, 0));
        assertEquals(range("2024-03-11T00:00:00Z", "2024-03-18T00:00:00Z"),
                monday.resolve(ConditionOperator.LAST_WEEK, 0));
    }

    @Test
    @DisplayName("Should clamp month arithmetic at month end")
    void shouldClampMonthEnd() {
        RelativeDateResolver endOfMarch = at("2024-03-31T12:00:00Z");

        assertEquals(range("2024-02-29T00:00:00Z", "2024-03-31T12:00:00Z"),
                endOfMarch.resolve(ConditionOperator.LAST_X_MONTHS, 1));
    }

    @Test
    @DisplayName("Should fail with DateTimeException past the calendar bounds")
    void shouldFailBeyondCalendar() {
        RelativeDateResolver now = at("2024-03-13T15:30:00Z");

        assertThrows(DateTimeException.class, () -> now.resolve(ConditionOperator.LAST_X_YEARS, 2_000_000_000));
        assertThrows(DateTimeException.class, () -> now.resolve(ConditionOperator.NEXT_X_YEARS, Integer.MAX_VALUE));
        assertDoesNotThrow(() -> now.resolve(ConditionOperator.LAST_X_HOURS, Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Should compute boundaries in the configured zone")
    void shouldUseZone() {
        RelativeDateResolver tokyo = new RelativeDateResolver(
                Clock.fixed(Instant.parse("2024-03-13T20:00:00Z"), ZoneOffset.UTC), ZoneId.of("Asia/Tokyo"));

        // 05:00 on the 14th in Tokyo
        assertEquals(range("2024-03-13T15:00:00Z", "2024-03-14T15:00:00Z"),
                tokyo.resolve(ConditionOperator.TODAY, 0));
    }

    @Test
    @DisplayName("Should reject operators that are not relative dates")
    void shouldRejectOtherOperators() {
        RelativeDateResolver resolver = at("2024-03-13T15:30:00Z");

        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(ConditionOperator.ON, 0));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(ConditionOperator.EQ, 1));
    }

    @Test
    @DisplayName("Should reject a non-positive count")
    void shouldRejectNonPositiveCount() {
        RelativeDateResolver resolver = at("2024-03-13T15:30:00Z");

        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(ConditionOperator.LAST_X_DAYS, 0));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(ConditionOperator.NEXT_X_HOURS, -2));
        assertDoesNotThrow(() -> resolver.resolve(ConditionOperator.TODAY, 0));
    }
}
