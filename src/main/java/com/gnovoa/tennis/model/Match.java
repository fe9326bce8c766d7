package com.gnovoa.tennis.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A team match between two teams of the same league.
 *
 * <p>Scheduling state is held in three fields only (facility, date, per-line start times). Every
 * status question ({@link #isScheduled()}, {@link #isPartiallyScheduled()}, ...) is derived from them
 * on each call so there is no stored flag that can drift.
 *
 * <p>The expected number of lines is the league's {@code numLinesPerMatch} unless the match was
 * scheduled with an explicit line count, which is kept until the match is unscheduled.
 */
public final class Match {

    /** Snapshot of the mutable scheduling fields, used to persist and to roll back. */
    public record Assignment(Facility facility, LocalDate date, List<LocalTime> scheduledTimes, Integer lineOverride) {

        public static final Assignment NONE = new Assignment(null, null, List.of(), null);

        public Assignment {
            scheduledTimes = scheduledTimes == null ? List.of() : List.copyOf(scheduledTimes);
        }
    }

    private final long id;
    private final League league;
    private final Team homeTeam;
    private final Team visitorTeam;

    private Facility facility;
    private LocalDate date;
    private List<LocalTime> scheduledTimes = List.of();
    private Integer lineOverride;

    public Match(long id, League league, Team homeTeam, Team visitorTeam) {
        this.id = id;
        this.league = Objects.requireNonNull(league, "league");
        this.homeTeam = Objects.requireNonNull(homeTeam, "homeTeam");
        this.visitorTeam = Objects.requireNonNull(visitorTeam, "visitorTeam");
        if (homeTeam.id() == visitorTeam.id()) {
            throw new IllegalArgumentException("A team cannot play itself (team " + homeTeam.id() + ")");
        }
    }

    public long id() { return id; }
    public League league() { return league; }
    public Team homeTeam() { return homeTeam; }
    public Team visitorTeam() { return visitorTeam; }
    public Facility facility() { return facility; }
    public LocalDate date() { return date; }
    public List<LocalTime> scheduledTimes() { return scheduledTimes; }

    public boolean involves(long teamId) {
        return homeTeam.id() == teamId || visitorTeam.id() == teamId;
    }

    public int expectedLines() {
        return lineOverride != null ? lineOverride : league.numLinesPerMatch();
    }

    public int missingLines() {
        return Math.max(0, expectedLines() - scheduledTimes.size());
    }

    /** @return true when a facility and a date are set, with or without times. */
    public boolean isPlaced() {
        return facility != null && date != null;
    }

    /** @return true when facility and date are set and at least one line has a time. */
    public boolean isScheduled() {
        return isPlaced() && !scheduledTimes.isEmpty();
    }

    /** @return true when nothing about the match is placed. */
    public boolean isUnscheduled() {
        return facility == null && date == null && scheduledTimes.isEmpty();
    }

    /**
     * A placed match with fewer timed lines than expected. A placement with no times at all (the
     * partial scheduling mode) also counts.
     */
    public boolean isPartiallyScheduled() {
        return isPlaced() && scheduledTimes.size() < expectedLines();
    }

    public boolean isFullyScheduled() {
        return isScheduled() && scheduledTimes.size() == expectedLines();
    }

    public MatchStatus status() {
        if (!isPlaced()) return MatchStatus.UNSCHEDULED;
        int lines = scheduledTimes.size();
        if (lines < expectedLines()) return MatchStatus.PARTIALLY_SCHEDULED;
        if (lines == expectedLines()) return MatchStatus.FULLY_SCHEDULED;
        return MatchStatus.OVER_SCHEDULED;
    }

    public Assignment assignment() {
        return new Assignment(facility, date, scheduledTimes, lineOverride);
    }

    /**
     * Places the match. Times are stored sorted ascending, one entry per line.
     *
     * @param lineOverride explicit line count for this match, or null to follow the league
     */
    public void assign(Facility facility, LocalDate date, List<LocalTime> times, Integer lineOverride) {
        List<LocalTime> sorted = new ArrayList<>(times == null ? List.of() : times);
        sorted.sort(Comparator.naturalOrder());
        this.facility = facility;
        this.date = date;
        this.scheduledTimes = List.copyOf(sorted);
        this.lineOverride = lineOverride;
    }

    public void restore(Assignment a) {
        assign(a.facility(), a.date(), a.scheduledTimes(), a.lineOverride());
    }

    public void clearAssignment() {
        restore(Assignment.NONE);
    }

    @Override
    public String toString() {
        return "Match " + id + " (" + homeTeam.name() + " vs " + visitorTeam.name() + ", " + status() + ")";
    }
}
