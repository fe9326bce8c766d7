package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.MatchStatus;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

public record MatchResponse(
        long id,
        long leagueId,
        String homeTeam,
        String visitorTeam,
        Long facilityId,
        String facility,
        LocalDate date,
        List<String> scheduledTimes,
        int expectedLines,
        MatchStatus status
) {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static MatchResponse from(Match m) {
        return new MatchResponse(
                m.id(),
                m.league().id(),
                m.homeTeam().name(),
                m.visitorTeam().name(),
                m.facility() == null ? null : m.facility().id(),
                m.facility() == null ? null : m.facility().name(),
                m.date(),
                m.scheduledTimes().stream().map(HH_MM::format).toList(),
                m.expectedLines(),
                m.status()
        );
    }
}
