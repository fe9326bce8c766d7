package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.error.CapacityException;
import com.gnovoa.tennis.error.InsufficientCapacityException;
import com.gnovoa.tennis.error.NoSingleSlotException;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.*;

/**
 * Decides the start time of every line of a match on one facility-day.
 *
 * <p>Works on the slots it is handed: the courts still open that day when picking automatically,
 * the facility's configured courts when the caller names the times. Each line occupies one court
 * at its start time. A plan either places all requested lines or fails; it never places some of
 * them.
 */
public final class SlotPlanner {

    private static final Logger log = LoggerFactory.getLogger(SlotPlanner.class);

    /**
     * @param match match being planned; its league decides whether lines may be split
     * @param numLines lines to place
     * @param options time option and caller-given times
     * @param open slots of the day in time order, with the courts usable at each
     * @return one start time per line, ascending; empty in partial mode
     */
    public List<LocalTime> plan(Match match, int numLines, SchedulingOptions options, List<TimeSlot> open) {
        if (options.partial()) return List.of();

        List<LocalTime> times = switch (options.timeOption()) {
            case SAME -> planSame(numLines, options.time(), open);
            case CUSTOM -> planCustom(match, numLines, options.times(), open);
            case AUTO -> planAuto(match, numLines, open);
        };
        log.debug("Planned match {} ({} lines, {}): {}", match.id(), numLines, options.timeOption(), times);
        return times;
    }

    private List<LocalTime> planSame(int numLines, LocalTime time, List<TimeSlot> open) {
        if (time == null) throw new IllegalArgumentException("Time option SAME needs a start time");
        int courts = courtsAt(open, time)
                .orElseThrow(() -> new CapacityException("No slot starts at " + time));
        if (courts < numLines) {
            throw new CapacityException("Slot " + time + " has " + courts + " court(s) left, " + numLines + " needed");
        }
        return Collections.nCopies(numLines, time);
    }

    private List<LocalTime> planCustom(Match match, int numLines, List<LocalTime> times, List<TimeSlot> open) {
        if (times.size() != numLines) {
            throw new IllegalArgumentException("Time option CUSTOM needs " + numLines + " time(s), got " + times.size());
        }
        if (!match.league().allowSplitLines() && new HashSet<>(times).size() > 1) {
            throw new NoSingleSlotException("League " + match.league().name()
                    + " does not allow split lines; custom times must all be equal");
        }
        Map<LocalTime, Integer> remaining = remainingByTime(open);
        for (LocalTime t : times) {
            Integer left = remaining.get(t);
            if (left == null) throw new CapacityException("No slot starts at " + t);
            if (left < 1) throw new CapacityException("Slot " + t + " is over-subscribed");
            remaining.put(t, left - 1);
        }
        List<LocalTime> sorted = new ArrayList<>(times);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Earliest slot that takes every line; failing that, and only when the league allows split
     * lines, lines are packed into slots in time order, filling each before moving on.
     */
    private List<LocalTime> planAuto(Match match, int numLines, List<TimeSlot> open) {
        for (TimeSlot s : open) {
            if (s.availableCourts() >= numLines) return Collections.nCopies(numLines, s.time());
        }
        if (!match.league().allowSplitLines()) {
            int best = open.stream().mapToInt(TimeSlot::availableCourts).max().orElse(0);
            throw new NoSingleSlotException("No single slot has " + numLines + " court(s); best has " + best);
        }
        int total = open.stream().mapToInt(TimeSlot::availableCourts).sum();
        if (total < numLines) {
            throw new InsufficientCapacityException("Only " + total + " court(s) open across the day, " + numLines + " needed");
        }
        List<LocalTime> times = new ArrayList<>(numLines);
        for (TimeSlot s : open) {
            int take = Math.min(s.availableCourts(), numLines - times.size());
            for (int i = 0; i < take; i++) times.add(s.time());
            if (times.size() == numLines) break;
        }
        return times;
    }

    private static Optional<Integer> courtsAt(List<TimeSlot> open, LocalTime time) {
        return open.stream().filter(s -> s.time().equals(time)).map(TimeSlot::availableCourts).findFirst();
    }

    private static Map<LocalTime, Integer> remainingByTime(List<TimeSlot> open) {
        Map<LocalTime, Integer> m = new HashMap<>();
        for (TimeSlot s : open) m.merge(s.time(), s.availableCourts(), Integer::sum);
        return m;
    }
}
