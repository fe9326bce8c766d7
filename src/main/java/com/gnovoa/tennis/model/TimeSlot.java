package com.gnovoa.tennis.model;

import java.time.LocalTime;
import java.util.Objects;

/** A configured start time at a facility and the number of courts offered at it. */
public record TimeSlot(LocalTime time, int availableCourts) {

    public TimeSlot {
        Objects.requireNonNull(time, "time");
        if (availableCourts < 0) {
            throw new IllegalArgumentException("Available courts must be >= 0, got " + availableCourts);
        }
    }

    public TimeSlot withCourts(int courts) {
        return new TimeSlot(time, courts);
    }
}
