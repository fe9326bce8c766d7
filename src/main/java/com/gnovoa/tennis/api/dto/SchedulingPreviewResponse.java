package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.error.ErrorKind;
import com.gnovoa.tennis.schedule.SchedulingPreview;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/** Answer of {@code POST /api/matches/{id}/preview}. Nothing is changed by the call. */
public record SchedulingPreviewResponse(
        long matchId,
        long facilityId,
        String facility,
        LocalDate date,
        int numLines,
        boolean schedulable,
        List<String> proposedTimes,
        ErrorKind problemKind,
        String problem,
        List<OpenSlot> openSlots
) {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public record OpenSlot(String time, int openCourts) {}

    public static SchedulingPreviewResponse from(SchedulingPreview p) {
        return new SchedulingPreviewResponse(
                p.matchId(),
                p.facility().id(),
                p.facility().name(),
                p.date(),
                p.numLines(),
                p.schedulable(),
                p.times().stream().map(HH_MM::format).toList(),
                p.problemKind(),
                p.problem(),
                p.openSlots().stream().map(s -> new OpenSlot(HH_MM.format(s.time()), s.availableCourts())).toList()
        );
    }
}
