package com.gnovoa.tennis.store;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.Team;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence collaborator of the scheduling engine.
 *
 * <p>Every match listing is ordered by match id ascending. Calls are synchronous and may fail with
 * any runtime exception; the engine treats such failures as fatal for the match being processed
 * only.
 */
public interface LeagueDataStore {

    Optional<League> league(long leagueId);
    List<League> leagues();
    List<Team> teamsByLeague(long leagueId);
    Optional<Team> team(long teamId);

    Optional<Facility> facility(long facilityId);
    List<Facility> facilities();

    Optional<Match> match(long matchId);
    List<Match> allMatches();
    List<Match> matchesByLeague(long leagueId);
    List<Match> matches(Predicate<Match> filter);

    void createMatch(Match match);

    /** Persists the facility, date, scheduled times and line override of the match. */
    void updateMatch(Match match);

    void deleteMatch(long matchId);

    void saveLeague(League league);
    void saveTeam(Team team);
    void saveFacility(Facility facility);
}
