package com.ayjx.core.schedule;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class DailyAtTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Test
    void next_slotAlreadyPassed_rollsToTomorrow() {
        ZonedDateTime now = ZonedDateTime.of(2024, 5, 10, 23, 31, 0, 0, UTC);

        ZonedDateTime next = DailyAt.of(23, 30, 0).next(now).orElseThrow();

        assertEquals(ZonedDateTime.of(2024, 5, 11, 23, 30, 0, 0, UTC), next);
    }

    @Test
    void next_slotLaterToday_firesToday() {
        ZonedDateTime now = ZonedDateTime.of(2024, 5, 10, 8, 0, 0, 0, UTC);

        ZonedDateTime next = DailyAt.of(23, 30, 0).next(now).orElseThrow();

        assertEquals(ZonedDateTime.of(2024, 5, 10, 23, 30, 0, 0, UTC), next);
    }

    @Test
    void next_exactlyAtSlot_rollsToTomorrow() {
        ZonedDateTime now = ZonedDateTime.of(2024, 5, 10, 23, 30, 0, 0, UTC);

        ZonedDateTime next = DailyAt.of(23, 30, 0).next(now).orElseThrow();

        assertEquals(11, next.getDayOfMonth());
    }

    @Test
    void next_skippedByDstGap_movesToNextDay() {
        // 2024-03-31 02:30 does not exist in Berlin
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 31, 0, 0, 0, 0, BERLIN);

        ZonedDateTime next = DailyAt.of(2, 30, 0).next(now).orElseThrow();

        assertEquals(ZonedDateTime.of(2024, 4, 1, 2, 30, 0, 0, BERLIN), next);
    }

    @Test
    void next_repeatedByDstOverlap_movesToNextDay() {
        // 2024-10-27 02:30 happens twice in Berlin
        ZonedDateTime now = ZonedDateTime.of(2024, 10, 27, 0, 0, 0, 0, BERLIN);

        ZonedDateTime next = DailyAt.of(2, 30, 0).next(now).orElseThrow();

        assertEquals(28, next.getDayOfMonth());
    }

    @Test
    void parse_acceptsHhMmSs() {
        assertEquals(java.time.LocalTime.of(7, 5, 9), DailyAt.parse("07:05:09").time());
    }

    @Test
    void parse_rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DailyAt.parse("7:05"));
        assertThrows(IllegalArgumentException.class, () -> DailyAt.parse("25:00:00"));
        assertThrows(IllegalArgumentException.class, () -> DailyAt.parse("aa:bb:cc"));
    }
}
