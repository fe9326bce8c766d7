package com.gnovoa.tennis.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * A tennis league and the formatting rules its matches are scheduled under.
 *
 * @param numMatches matches every team must play
 * @param numLinesPerMatch courts a single team match occupies
 * @param allowSplitLines whether lines may start at different times on the same day
 * @param preferredFacilityIds facilities tried after the teams' own facilities when auto-scheduling
 */
public record League(
        long id,
        String name,
        int year,
        String section,
        String region,
        String ageGroup,
        String division,
        int numMatches,
        int numLinesPerMatch,
        boolean allowSplitLines,
        List<DayOfWeek> preferredDays,
        List<DayOfWeek> backupDays,
        LocalDate startDate,
        LocalDate endDate,
        List<Long> preferredFacilityIds
) {
    public League {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("League name is required");
        if (numMatches < 1) throw new IllegalArgumentException("numMatches must be >= 1, got " + numMatches);
        if (numLinesPerMatch < 1) {
            throw new IllegalArgumentException("numLinesPerMatch must be >= 1, got " + numLinesPerMatch);
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("League " + name + " ends before it starts");
        }
        preferredDays = preferredDays == null ? List.of() : List.copyOf(preferredDays);
        backupDays = backupDays == null ? List.of() : List.copyOf(backupDays);
        preferredFacilityIds = preferredFacilityIds == null ? List.of() : List.copyOf(preferredFacilityIds);
    }
}
