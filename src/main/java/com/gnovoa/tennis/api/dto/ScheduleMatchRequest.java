package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.schedule.SchedulingOptions;
import com.gnovoa.tennis.schedule.TimeOption;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Body of {@code POST /api/matches/{id}/schedule}. Times are {@code HH:mm}.
 *
 * @param timeOption defaults to AUTO
 * @param time start time for SAME
 * @param times one start time per line for CUSTOM
 */
public record ScheduleMatchRequest(
        Long facilityId,
        LocalDate date,
        TimeOption timeOption,
        LocalTime time,
        List<LocalTime> times,
        Integer numLines,
        Boolean partial
) {
    public SchedulingOptions toOptions() {
        return new SchedulingOptions(
                timeOption == null ? TimeOption.AUTO : timeOption,
                time,
                times,
                numLines,
                Boolean.TRUE.equals(partial)
        );
    }
}
