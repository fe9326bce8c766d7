package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.config.SchedulerProperties;
import com.gnovoa.tennis.model.League;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Uses the league's own start and end dates. A missing start falls back to today, a missing end to
 * {@code scheduler.default-season-weeks} after the start.
 */
public final class LeagueSeasonWindowProvider implements SeasonWindowProvider {

    private final Clock clock;
    private final SchedulerProperties props;

    public LeagueSeasonWindowProvider(Clock clock, SchedulerProperties props) {
        this.clock = clock;
        this.props = props;
    }

    @Override
    public SeasonWindow window(League league) {
        LocalDate start = league.startDate() != null ? league.startDate() : LocalDate.now(clock);
        LocalDate end = league.endDate() != null ? league.endDate() : start.plusWeeks(props.defaultSeasonWeeks());
        return new SeasonWindow(start, end);
    }
}
