package com.ayjx.core.schedule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes when a scheduled task should fire next. Returning empty ends the
 * schedule.
 */
@FunctionalInterface
public interface NextRunCalculator {

    Optional<ZonedDateTime> next(ZonedDateTime now);
}
