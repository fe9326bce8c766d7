package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.config.SchedulerProperties;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.*;

/**
 * Dates worth trying when auto-scheduling a match, best first.
 *
 * <p>Only dates inside the league's season window on a league play day are offered (every day when
 * the league names none). Team preferences narrow this: when both teams name preferred days a date
 * must be on a day both share, when only one does it must be on one of that team's days.
 *
 * <p>Order: league preferred days, then backup days, then the rest; chronological within each.
 */
public final class CandidateDates {

    private final SeasonWindowProvider seasons;
    private final int maxDates;

    public CandidateDates(SeasonWindowProvider seasons, SchedulerProperties props) {
        this.seasons = seasons;
        this.maxDates = props.maxCandidateDates();
    }

    public List<LocalDate> candidates(Match match) {
        League league = match.league();
        Set<DayOfWeek> leagueDays = EnumSet.noneOf(DayOfWeek.class);
        leagueDays.addAll(league.preferredDays());
        leagueDays.addAll(league.backupDays());
        if (leagueDays.isEmpty()) leagueDays = EnumSet.allOf(DayOfWeek.class);

        Optional<Set<DayOfWeek>> required = requiredDays(match);
        if (required.isPresent() && required.get().isEmpty()) return List.of();

        Set<DayOfWeek> allowed = leagueDays;
        Comparator<LocalDate> byPriority = Comparator
                .comparingInt((LocalDate d) -> priority(d.getDayOfWeek(), league))
                .thenComparing(Comparator.<LocalDate>naturalOrder());

        return seasons.window(league).dates()
                .filter(d -> allowed.contains(d.getDayOfWeek()))
                .filter(d -> required.map(days -> days.contains(d.getDayOfWeek())).orElse(true))
                .sorted(byPriority)
                .limit(maxDates)
                .toList();
    }

    /** Empty when neither team states a preference. */
    private static Optional<Set<DayOfWeek>> requiredDays(Match match) {
        List<DayOfWeek> home = match.homeTeam().preferredDays();
        List<DayOfWeek> away = match.visitorTeam().preferredDays();
        if (home.isEmpty() && away.isEmpty()) return Optional.empty();

        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (!home.isEmpty() && !away.isEmpty()) {
            days.addAll(home);
            days.retainAll(away);
        } else {
            days.addAll(home);
            days.addAll(away);
        }
        return Optional.of(days);
    }

    private static int priority(DayOfWeek day, League league) {
        if (league.preferredDays().contains(day)) return 0;
        if (league.backupDays().contains(day)) return 1;
        return 2;
    }
}
