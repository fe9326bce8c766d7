package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.error.CapacityException;
import com.gnovoa.tennis.error.DeleteUnsafeException;
import com.gnovoa.tennis.error.SchedulingException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.TimeSlot;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Places, clears and deletes single matches.
 *
 * <p>A match is only changed once every check has passed and the store has accepted the new
 * state. If the store rejects it, the previous state is put back before the error propagates.
 */
public final class MatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(MatchScheduler.class);

    /** A checked placement that has not been applied yet. */
    public record Placement(Facility facility, LocalDate date, List<LocalTime> times, Integer lineOverride) {

        public Placement {
            times = List.copyOf(times);
        }
    }

    private final AvailabilityModel availability;
    private final SlotPlanner planner;
    private final ConflictChecker conflicts;
    private final LeagueDataStore store;

    public MatchScheduler(AvailabilityModel availability, SlotPlanner planner, ConflictChecker conflicts, LeagueDataStore store) {
        this.availability = availability;
        this.planner = planner;
        this.conflicts = conflicts;
        this.store = store;
    }

    /**
     * Schedules {@code match} at the facility on the date.
     *
     * @return the same match instance, updated
     * @throws IllegalArgumentException if facility or date is missing, or the options are malformed
     * @throws SchedulingException when the match cannot be placed there
     */
    public Match schedule(Match match, Facility facility, LocalDate date, SchedulingOptions options) {
        Placement placement = plan(match, facility, date, options);

        Match.Assignment previous = match.assignment();
        match.assign(placement.facility(), placement.date(), placement.times(), placement.lineOverride());
        commit(match, previous);

        log.info("Scheduled match {} at {} on {} {}", match.id(), facility.name(), date,
                placement.times().isEmpty() ? "(no times)" : placement.times());
        return match;
    }

    /**
     * Works out where the lines of {@code match} would go and checks the result against current
     * bookings, without touching the match or the store.
     *
     * <p>AUTO picks among the courts still open. SAME and CUSTOM name their slots, so they are
     * planned against what the facility offers and a slot already taken by other matches surfaces
     * as a {@link com.gnovoa.tennis.error.ConflictException}.
     */
    public Placement plan(Match match, Facility facility, LocalDate date, SchedulingOptions options) {
        if (facility == null || date == null) {
            throw new IllegalArgumentException("Facility and date are required to schedule match " + match.id());
        }
        if (facility.isUnavailableOn(date)) {
            throw new CapacityException("Facility " + facility.name() + " is unavailable on " + date);
        }
        int numLines = lineCount(match, options);

        List<TimeSlot> slots = options.timeOption() == TimeOption.AUTO
                ? conflicts.remainingAvailability(facility, date, match.id())
                : availability.availability(facility, date);
        List<LocalTime> times = planner.plan(match, numLines, options, slots);
        conflicts.verify(match, facility, date, times);
        return new Placement(facility, date, times, options.numLines());
    }

    /**
     * Reports what {@link #schedule} would do with these arguments. Scheduling failures are part of
     * the answer instead of being thrown.
     *
     * @throws IllegalArgumentException if facility or date is missing, or the options are malformed
     */
    public SchedulingPreview preview(Match match, Facility facility, LocalDate date, SchedulingOptions options) {
        if (facility == null || date == null) {
            throw new IllegalArgumentException("Facility and date are required to preview match " + match.id());
        }
        int numLines = lineCount(match, options);
        List<TimeSlot> open = conflicts.remainingAvailability(facility, date, match.id());
        try {
            Placement p = plan(match, facility, date, options);
            return SchedulingPreview.schedulable(match.id(), facility, date, numLines, p.times(), open);
        } catch (SchedulingException e) {
            log.debug("Preview of match {} at {} on {}: {}", match.id(), facility.name(), date, e.getMessage());
            return SchedulingPreview.blocked(match.id(), facility, date, numLines, open, e);
        }
    }

    /** Clears facility, date and times. Clearing an unscheduled match is a no-op that still succeeds. */
    public Match unschedule(Match match) {
        Match.Assignment previous = match.assignment();
        match.clearAssignment();
        commit(match, previous);
        log.info("Unscheduled match {}", match.id());
        return match;
    }

    /** Puts back an assignment taken earlier with {@link Match#assignment()}. */
    public void revert(Match match, Match.Assignment assignment) {
        Match.Assignment current = match.assignment();
        match.restore(assignment);
        commit(match, current);
    }

    /**
     * Deletes a match that has no facility, date or times.
     *
     * @throws DeleteUnsafeException if the match is scheduled or partially scheduled
     */
    public void delete(Match match) {
        checkDeletable(match);
        store.deleteMatch(match.id());
        log.info("Deleted match {}", match.id());
    }

    /** @throws DeleteUnsafeException if the match is scheduled or partially scheduled */
    public void checkDeletable(Match match) {
        if (match.isScheduled() || match.isPartiallyScheduled()) {
            throw new DeleteUnsafeException("Match " + match.id() + " is " + match.status()
                    + "; unschedule it before deleting");
        }
    }

    private static int lineCount(Match match, SchedulingOptions options) {
        return options.numLines() != null ? options.numLines() : match.league().numLinesPerMatch();
    }

    private void commit(Match match, Match.Assignment previous) {
        try {
            store.updateMatch(match);
        } catch (RuntimeException e) {
            match.restore(previous);
            throw e;
        }
    }
}
