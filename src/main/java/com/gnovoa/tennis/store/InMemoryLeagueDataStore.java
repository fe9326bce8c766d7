package com.gnovoa.tennis.store;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.Team;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Keeps leagues, teams, facilities and matches in memory (no DB).
 *
 * <p>Matches are stored as their own records: an update copies the scheduling fields of the given
 * match into the stored one, so callers holding a detached copy cannot change stored state without
 * going through {@link #updateMatch(Match)}.
 */
@Component
public final class InMemoryLeagueDataStore implements LeagueDataStore {

    private final Map<Long, League> leagues = new ConcurrentHashMap<>();
    private final Map<Long, Team> teams = new ConcurrentHashMap<>();
    private final Map<Long, Facility> facilities = new ConcurrentHashMap<>();
    private final Map<Long, Match> matches = new ConcurrentHashMap<>();

    @Override public Optional<League> league(long leagueId) { return Optional.ofNullable(leagues.get(leagueId)); }
    @Override public Optional<Team> team(long teamId) { return Optional.ofNullable(teams.get(teamId)); }
    @Override public Optional<Facility> facility(long facilityId) { return Optional.ofNullable(facilities.get(facilityId)); }
    @Override public Optional<Match> match(long matchId) { return Optional.ofNullable(matches.get(matchId)); }

    @Override
    public List<League> leagues() {
        return leagues.values().stream().sorted(Comparator.comparingLong(League::id)).toList();
    }

    @Override
    public List<Team> teamsByLeague(long leagueId) {
        return teams.values().stream()
                .filter(t -> t.leagueId() == leagueId)
                .sorted(Comparator.comparingLong(Team::id))
                .toList();
    }

    @Override
    public List<Facility> facilities() {
        return facilities.values().stream().sorted(Comparator.comparingLong(Facility::id)).toList();
    }

    @Override
    public List<Match> allMatches() {
        return matches(m -> true);
    }

    @Override
    public List<Match> matchesByLeague(long leagueId) {
        return matches(m -> m.league().id() == leagueId);
    }

    @Override
    public List<Match> matches(Predicate<Match> filter) {
        return matches.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(Match::id))
                .toList();
    }

    @Override
    public void createMatch(Match match) {
        if (matches.putIfAbsent(match.id(), match) != null) {
            throw new IllegalStateException("Match " + match.id() + " already exists");
        }
    }

    @Override
    public void updateMatch(Match match) {
        Match stored = matches.get(match.id());
        if (stored == null) throw new NoSuchElementException("Match " + match.id() + " not found");
        if (stored != match) stored.restore(match.assignment());
    }

    @Override
    public void deleteMatch(long matchId) {
        if (matches.remove(matchId) == null) throw new NoSuchElementException("Match " + matchId + " not found");
    }

    @Override public void saveLeague(League league) { leagues.put(league.id(), league); }
    @Override public void saveTeam(Team team) { teams.put(team.id(), team); }
    @Override public void saveFacility(Facility facility) { facilities.put(facility.id(), facility); }
}
