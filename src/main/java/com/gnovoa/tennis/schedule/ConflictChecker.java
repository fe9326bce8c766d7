package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.config.SchedulerProperties;
import com.gnovoa.tennis.error.ConflictException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.TimeSlot;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;

/**
 * Checks a proposed placement against what is already booked.
 *
 * <p>Bookings are read from the store on every call, never cached, so matches committed earlier in
 * the same bulk run are seen by the next one.
 *
 * <p>Court capacity is counted per slot: a line booked at a slot's start time takes one of that
 * slot's courts. Team clashes use time windows: a line starting at {@code t} keeps its team busy
 * until {@code t + matchDurationMinutes}. A match placed without times blocks its teams for the
 * whole day.
 */
public final class ConflictChecker {

    private static final Logger log = LoggerFactory.getLogger(ConflictChecker.class);

    private final AvailabilityModel availabilityModel;
    private final LeagueDataStore store;
    private final Duration lineDuration;

    public ConflictChecker(AvailabilityModel availabilityModel, LeagueDataStore store, SchedulerProperties props) {
        this.availabilityModel = availabilityModel;
        this.store = store;
        this.lineDuration = Duration.ofMinutes(props.matchDurationMinutes());
    }

    /**
     * Open slots of a facility-day after subtracting courts already booked by other matches.
     *
     * @param excludeMatchId match whose own booking is ignored (the one being rescheduled)
     */
    public List<TimeSlot> remainingAvailability(Facility facility, LocalDate date, long excludeMatchId) {
        Map<LocalTime, Integer> booked = bookedLines(facility, date, excludeMatchId);
        List<TimeSlot> open = new ArrayList<>();
        for (TimeSlot slot : availabilityModel.availability(facility, date)) {
            int left = slot.availableCourts() - booked.getOrDefault(slot.time(), 0);
            open.add(slot.withCourts(Math.max(0, left)));
        }
        return open;
    }

    /**
     * @throws ConflictException when a slot would exceed its courts, or when either team already
     *         plays at an overlapping time that day
     */
    public void verify(Match match, Facility facility, LocalDate date, List<LocalTime> times) {
        verifyCapacity(match, facility, date, times);
        verifyTeams(match, date, times);
    }

    private void verifyCapacity(Match match, Facility facility, LocalDate date, List<LocalTime> times) {
        if (times.isEmpty()) return;
        Map<LocalTime, Integer> courts = new HashMap<>();
        for (TimeSlot s : availabilityModel.availability(facility, date)) courts.merge(s.time(), s.availableCourts(), Integer::sum);

        Map<LocalTime, Integer> used = bookedLines(facility, date, match.id());
        for (LocalTime t : times) used.merge(t, 1, Integer::sum);

        for (LocalTime t : new TreeSet<>(times)) {
            int offered = courts.getOrDefault(t, 0);
            if (used.get(t) > offered) {
                throw new ConflictException("Facility " + facility.name() + " on " + date + " at " + t + ": "
                        + used.get(t) + " line(s) for " + offered + " court(s)");
            }
        }
    }

    private void verifyTeams(Match match, LocalDate date, List<LocalTime> times) {
        for (Match other : store.matches(m -> m.id() != match.id() && date.equals(m.date()) && m.isPlaced())) {
            for (long teamId : new long[]{match.homeTeam().id(), match.visitorTeam().id()}) {
                if (other.involves(teamId) && overlaps(times, other.scheduledTimes())) {
                    log.debug("Team {} clash between match {} and match {} on {}", teamId, match.id(), other.id(), date);
                    throw new ConflictException("Team " + teamName(match, teamId) + " already plays match "
                            + other.id() + " on " + date + " at an overlapping time");
                }
            }
        }
    }

    private boolean overlaps(List<LocalTime> a, List<LocalTime> b) {
        if (a.isEmpty() || b.isEmpty()) return true;
        for (LocalTime x : a) {
            for (LocalTime y : b) {
                if (x.isBefore(end(y)) && y.isBefore(end(x))) return true;
            }
        }
        return false;
    }

    // clamp at midnight so late slots do not wrap around
    private LocalTime end(LocalTime start) {
        long minutesLeft = Duration.between(start, LocalTime.MAX).toMinutes();
        return lineDuration.toMinutes() > minutesLeft ? LocalTime.MAX : start.plus(lineDuration);
    }

    private Map<LocalTime, Integer> bookedLines(Facility facility, LocalDate date, long excludeMatchId) {
        Map<LocalTime, Integer> booked = new HashMap<>();
        store.matches(m -> m.id() != excludeMatchId && m.facility() != null
                        && m.facility().id() == facility.id() && date.equals(m.date()))
                .forEach(m -> m.scheduledTimes().forEach(t -> booked.merge(t, 1, Integer::sum)));
        return booked;
    }

    private static String teamName(Match match, long teamId) {
        return match.homeTeam().id() == teamId ? match.homeTeam().name() : match.visitorTeam().name();
    }
}
