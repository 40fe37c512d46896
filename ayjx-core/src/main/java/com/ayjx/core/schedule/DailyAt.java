package com.ayjx.core.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Fires once a day at a fixed wall-clock time.
 * <p>
 * A local time that does not map to exactly one instant on a given day
 * (skipped or repeated by a DST transition) is not used for that day; the
 * calculator moves on to the following day instead.
 */
public final class DailyAt implements NextRunCalculator {

    private static final int MAX_DAYS_AHEAD = 7;

    private final LocalTime time;

    public DailyAt(LocalTime time) {
        this.time = time;
    }

    public static DailyAt of(int hour, int minute, int second) {
        return new DailyAt(LocalTime.of(hour, minute, second));
    }

    /**
     * Parse {@code HH:MM:SS}.
     *
     * @throws IllegalArgumentException on a malformed or out-of-range value
     */
    public static DailyAt parse(String hhmmss) {
        String[] parts = hhmmss.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("expected HH:MM:SS, got '" + hhmmss + "'");
        }
        try {
            return of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid time '" + hhmmss + "'", e);
        }
    }

    public LocalTime time() {
        return time;
    }

    @Override
    public Optional<ZonedDateTime> next(ZonedDateTime now) {
        ZoneId zone = now.getZone();
        LocalDate day = now.toLocalDate();
        for (int i = 0; i <= MAX_DAYS_AHEAD; i++) {
            Optional<ZonedDateTime> candidate = unambiguous(LocalDateTime.of(day.plusDays(i), time), zone);
            if (candidate.isPresent() && candidate.get().isAfter(now)) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private static Optional<ZonedDateTime> unambiguous(LocalDateTime local, ZoneId zone) {
        var offsets = zone.getRules().getValidOffsets(local);
        if (offsets.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(ZonedDateTime.ofLocal(local, zone, offsets.get(0)));
    }

    @Override
    public String toString() {
        return "daily at " + time;
    }
}
