package com.gnovoa.tennis.model;

import java.time.DayOfWeek;
import java.util.List;

/** A team belongs to exactly one league and plays home matches at one facility. */
public record Team(
        long id, String name, long leagueId, String captain, long homeFacilityId, List<DayOfWeek> preferredDays) {

    public Team {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Team name is required");
        preferredDays = preferredDays == null ? List.of() : List.copyOf(preferredDays);
    }
}
