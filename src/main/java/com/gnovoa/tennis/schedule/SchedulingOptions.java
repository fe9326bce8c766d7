package com.gnovoa.tennis.schedule;

import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * Caller choices for scheduling one match.
 *
 * @param timeOption how line times are chosen
 * @param time the shared start time for {@link TimeOption#SAME}
 * @param times one start time per line for {@link TimeOption#CUSTOM}
 * @param numLines line count override; null means the league's {@code numLinesPerMatch}
 * @param partial place facility and date only, without any line times
 */
public record SchedulingOptions(TimeOption timeOption, LocalTime time, List<LocalTime> times, Integer numLines, boolean partial) {

    public SchedulingOptions {
        Objects.requireNonNull(timeOption, "timeOption");
        times = times == null ? List.of() : List.copyOf(times);
        if (numLines != null && numLines < 1) throw new IllegalArgumentException("numLines must be >= 1, got " + numLines);
    }

    public static SchedulingOptions auto() {
        return new SchedulingOptions(TimeOption.AUTO, null, List.of(), null, false);
    }

    public static SchedulingOptions same(LocalTime time) {
        return new SchedulingOptions(TimeOption.SAME, time, List.of(), null, false);
    }

    public static SchedulingOptions custom(List<LocalTime> times) {
        return new SchedulingOptions(TimeOption.CUSTOM, null, times, null, false);
    }

    public static SchedulingOptions partialOnly() {
        return new SchedulingOptions(TimeOption.AUTO, null, List.of(), null, true);
    }

    public SchedulingOptions withNumLines(int lines) {
        return new SchedulingOptions(timeOption, time, times, lines, partial);
    }
}
