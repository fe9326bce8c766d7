package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.runner.SchedulingSummary;

public record SummaryResponse(
        long leagueId,
        int totalMatches,
        int scheduledMatches,
        int unscheduledMatches,
        int partiallyScheduledMatches,
        int fullyScheduledMatches,
        int scheduledLines,
        int expectedLines,
        double completionPercent
) {
    public static SummaryResponse of(long leagueId, SchedulingSummary s) {
        return new SummaryResponse(leagueId, s.totalMatches(), s.scheduledMatches(), s.unscheduledMatches(),
                s.partiallyScheduledMatches(), s.fullyScheduledMatches(), s.scheduledLines(), s.expectedLines(),
                s.completionPercent());
    }
}
