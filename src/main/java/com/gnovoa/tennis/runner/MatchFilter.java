package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.model.Match;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filter behind the "currently filtered matches" bulk scope.
 *
 * <p>Every set criterion must hold. Date bounds are inclusive and exclude unplaced matches. The
 * search text is split on whitespace and every term must appear (case-insensitive) in the match's
 * searchable text: id, team, facility and league names, date and line times.
 *
 * @param leagueId null for any league
 * @param startDate null for no lower bound
 * @param endDate null for no upper bound
 * @param search null or blank for no text search
 */
public record MatchFilter(Long leagueId, LocalDate startDate, LocalDate endDate, String search)
        implements Predicate<Match> {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public boolean test(Match m) {
        if (leagueId != null && m.league().id() != leagueId) return false;
        if (startDate != null && (m.date() == null || m.date().isBefore(startDate))) return false;
        if (endDate != null && (m.date() == null || m.date().isAfter(endDate))) return false;
        if (search == null || search.isBlank()) return true;

        String haystack = searchableText(m);
        return Arrays.stream(search.trim().toLowerCase(Locale.ROOT).split("\\s+")).allMatch(haystack::contains);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("filtered matches");
        if (leagueId != null) sb.append(" league=").append(leagueId);
        if (startDate != null) sb.append(" from=").append(startDate);
        if (endDate != null) sb.append(" to=").append(endDate);
        if (search != null && !search.isBlank()) sb.append(" search='").append(search.trim()).append('\'');
        return sb.toString();
    }

    private static String searchableText(Match m) {
        StringBuilder sb = new StringBuilder()
                .append(m.id()).append(' ')
                .append(m.homeTeam().name()).append(' ')
                .append(m.visitorTeam().name()).append(' ')
                .append(m.league().name()).append(' ');
        if (m.facility() != null) sb.append(m.facility().name()).append(' ');
        if (m.date() != null) sb.append(m.date()).append(' ');
        sb.append(m.scheduledTimes().stream().map(HH_MM::format).collect(Collectors.joining(" ")));
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
