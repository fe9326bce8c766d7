package com.gnovoa.tennis.model;

import java.time.LocalDate;
import java.util.Set;

/**
 * A venue with a weekly court template and blackout dates.
 *
 * <p>A blackout date removes every slot on that date regardless of the weekly template.
 */
public record Facility(
        long id,
        String name,
        String location,
        int totalCourts,
        WeeklySchedule schedule,
        Set<LocalDate> unavailableDates
) {
    public Facility {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Facility name is required");
        schedule = schedule == null ? WeeklySchedule.empty() : schedule;
        unavailableDates = unavailableDates == null ? Set.of() : Set.copyOf(unavailableDates);
    }

    public boolean isUnavailableOn(LocalDate date) {
        return unavailableDates.contains(date);
    }
}
