package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.TimeSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * What a facility physically offers on a date: the weekday's template slots in time order, or
 * nothing on a blackout date. Bookings are not considered here; see {@link ConflictChecker}.
 */
public final class AvailabilityModel {

    public List<TimeSlot> availability(Facility facility, LocalDate date) {
        if (facility.isUnavailableOn(date)) return List.of();
        return facility.schedule().slotsFor(date.getDayOfWeek());
    }
}
