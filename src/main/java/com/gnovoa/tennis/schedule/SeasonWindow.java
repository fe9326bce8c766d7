package com.gnovoa.tennis.schedule;

import java.time.LocalDate;
import java.util.stream.Stream;

/**
 * Inclusive date range a league's matches may be played in. A window whose end falls before its
 * start is empty: it offers no dates.
 */
public record SeasonWindow(LocalDate start, LocalDate end) {

    public SeasonWindow {
        if (start == null || end == null) throw new IllegalArgumentException("Season needs a start and an end");
    }

    public boolean isEmpty() {
        return end.isBefore(start);
    }

    public Stream<LocalDate> dates() {
        return isEmpty() ? Stream.empty() : start.datesUntil(end.plusDays(1));
    }
}
