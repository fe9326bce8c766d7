package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.runner.SchedulingFacade;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

public record AvailabilityResponse(long facilityId, LocalDate date, List<Slot> slots) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    /** {@code courts} is what the template offers, {@code openCourts} what is not yet booked. */
    public record Slot(String time, int courts, int openCourts) {}

    public static AvailabilityResponse of(long facilityId, LocalDate date, List<SchedulingFacade.SlotAvailability> slots) {
        return new AvailabilityResponse(facilityId, date, slots.stream()
                .map(s -> new Slot(HH_MM.format(s.configured().time()), s.configured().availableCourts(), s.openCourts()))
                .toList());
    }
}
