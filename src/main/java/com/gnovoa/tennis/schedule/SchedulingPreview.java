package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.error.ErrorKind;
import com.gnovoa.tennis.error.SchedulingException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Outcome of trying a placement without applying it.
 *
 * @param times planned start times; empty when blocked or in partial mode
 * @param openSlots the facility's slots that day with the courts other matches leave open
 * @param problemKind why the placement is blocked; null when it is schedulable
 */
public record SchedulingPreview(
        long matchId,
        Facility facility,
        LocalDate date,
        int numLines,
        List<LocalTime> times,
        List<TimeSlot> openSlots,
        boolean schedulable,
        ErrorKind problemKind,
        String problem
) {
    public SchedulingPreview {
        times = List.copyOf(times);
        openSlots = List.copyOf(openSlots);
    }

    static SchedulingPreview schedulable(long matchId, Facility facility, LocalDate date, int numLines,
                                         List<LocalTime> times, List<TimeSlot> open) {
        return new SchedulingPreview(matchId, facility, date, numLines, times, open, true, null, null);
    }

    static SchedulingPreview blocked(long matchId, Facility facility, LocalDate date, int numLines,
                                     List<TimeSlot> open, SchedulingException e) {
        return new SchedulingPreview(matchId, facility, date, numLines, List.of(), open, false, e.kind(), e.getMessage());
    }
}
