package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.schedule.MatchScheduler;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

public record PlacementOptionResponse(LocalDate date, long facilityId, String facility, List<String> times) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static PlacementOptionResponse from(MatchScheduler.Placement p) {
        return new PlacementOptionResponse(p.date(), p.facility().id(), p.facility().name(),
                p.times().stream().map(HH_MM::format).toList());
    }
}
