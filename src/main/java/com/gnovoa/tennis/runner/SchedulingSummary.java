package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.model.Match;

import java.util.List;

/** Progress of a set of matches toward being fully scheduled. */
public record SchedulingSummary(
        int totalMatches,
        int scheduledMatches,
        int unscheduledMatches,
        int partiallyScheduledMatches,
        int fullyScheduledMatches,
        int scheduledLines,
        int expectedLines
) {

    public static SchedulingSummary of(List<Match> matches) {
        int scheduled = 0, unscheduled = 0, partial = 0, full = 0, lines = 0, expected = 0;
        for (Match m : matches) {
            if (m.isScheduled()) scheduled++;
            if (!m.isPlaced()) unscheduled++;
            if (m.isPartiallyScheduled()) partial++;
            if (m.isFullyScheduled()) full++;
            lines += m.scheduledTimes().size();
            expected += m.expectedLines();
        }
        return new SchedulingSummary(matches.size(), scheduled, unscheduled, partial, full, lines, expected);
    }

    /** Fully scheduled matches as a percentage of all matches, one decimal; 0 when there are none. */
    public double completionPercent() {
        if (totalMatches == 0) return 0.0;
        return Math.round(fullyScheduledMatches * 1000.0 / totalMatches) / 10.0;
    }
}
