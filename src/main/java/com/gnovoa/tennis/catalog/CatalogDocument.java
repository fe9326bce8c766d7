package com.gnovoa.tennis.catalog;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Team;
import com.gnovoa.tennis.model.TimeSlot;
import com.gnovoa.tennis.model.WeeklySchedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON shape of a catalog seed file: facilities, leagues and teams.
 *
 * <p>Leagues and teams map straight onto the domain records; facilities carry their weekly
 * schedule as a weekday keyed map of slots.
 */
public record CatalogDocument(List<FacilityEntry> facilities, List<League> leagues, List<Team> teams) {

    public CatalogDocument {
        facilities = facilities == null ? List.of() : List.copyOf(facilities);
        leagues = leagues == null ? List.of() : List.copyOf(leagues);
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    public record FacilityEntry(
            long id,
            String name,
            String location,
            int totalCourts,
            Map<DayOfWeek, List<TimeSlot>> schedule,
            Set<LocalDate> unavailableDates
    ) {
        public Facility toFacility() {
            return new Facility(id, name, location, totalCourts, new WeeklySchedule(schedule), unavailableDates);
        }
    }
}
