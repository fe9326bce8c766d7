package com.gnovoa.tennis.fixtures;

import com.gnovoa.tennis.error.InsufficientTeamsException;
import com.gnovoa.tennis.error.UnfairScheduleException;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.LongPredicate;

/**
 * Produces the unscheduled matches of a league so that every team plays exactly
 * {@link League#numMatches()} matches.
 *
 * <p>Pairings come from the circle-method round-robin, cycled as often as needed. Within cycle
 * {@code k} a pair is only taken if it has met at most {@code k} times, so every team meets every
 * other team before any pairing repeats, and pairings that already exist are not duplicated before
 * the others have caught up.
 *
 * <p>Generation only fills the deficit: matches already present for the league count toward each
 * team's total, so calling it twice in a row creates nothing the second time.
 */
public final class FixtureGenerator {

    private static final Logger log = LoggerFactory.getLogger(FixtureGenerator.class);

    /** Newly created matches, in round order. */
    public record Result(List<Match> created) {
        public int createdCount() { return created.size(); }
    }

    private final RoundRobinScheduler roundRobin;

    public FixtureGenerator(RoundRobinScheduler roundRobin) {
        this.roundRobin = roundRobin;
    }

    public Result generate(League league, List<Team> teams, List<Match> existing) {
        return generate(league, teams, existing, id -> false);
    }

    /**
     * @param league league whose {@code numMatches} is the per-team target
     * @param teams teams of the league
     * @param existing matches the league already has (may be empty)
     * @param idTaken ids already used elsewhere, for example by another league's fixtures; they are skipped
     * @throws InsufficientTeamsException with fewer than two teams
     * @throws UnfairScheduleException when the target cannot be paired evenly
     */
    public Result generate(League league, List<Team> teams, List<Match> existing, LongPredicate idTaken) {
        if (teams.size() < 2) {
            throw new InsufficientTeamsException(
                    "League " + league.name() + " has " + teams.size() + " team(s); at least 2 are required");
        }
        int target = league.numMatches();
        if (((long) teams.size() * target) % 2 != 0) {
            throw new UnfairScheduleException("League " + league.name() + ": " + teams.size() + " teams x "
                    + target + " matches each is odd, the matches cannot be paired evenly");
        }

        List<Team> sorted = new ArrayList<>(teams);
        sorted.sort(Comparator.comparingLong(Team::id));
        Tally tally = new Tally(league, sorted, existing);

        List<RoundRobinScheduler.Pairing> picked = pick(sorted, tally, target);
        repairLoneDeficit(league, sorted, tally, target, picked);

        var oriented = new HomeAwayBalancer(tally.homes, tally.lastHost).orient(picked);

        long nextId = Math.max(MatchIds.baseId(league), existing.stream().mapToLong(Match::id).max().orElse(0L));
        List<Match> created = new ArrayList<>(oriented.size());
        for (var o : oriented) {
            do {
                nextId++;
            } while (idTaken.test(nextId));
            created.add(new Match(nextId, league, o.home, o.away));
        }

        log.info("Generated {} match(es) for league {} ({} teams, {} per team, {} existing)",
                created.size(), league.id(), sorted.size(), target, existing.size());
        return new Result(List.copyOf(created));
    }

    private List<RoundRobinScheduler.Pairing> pick(List<Team> teams, Tally tally, int target) {
        List<RoundRobinScheduler.Round> rounds = roundRobin.singleRoundRobin(teams);
        List<RoundRobinScheduler.Pairing> picked = new ArrayList<>();

        for (int cycle = 0; !tally.allReached(target); cycle++) {
            int accepted = 0;
            for (var round : rounds) {
                for (var p : round.pairings()) {
                    long a = p.first().id();
                    long b = p.second().id();
                    if (tally.games(a) >= target || tally.games(b) >= target) continue;
                    if (tally.meetings(a, b) > cycle) continue;
                    tally.play(a, b);
                    picked.add(p);
                    accepted++;
                }
            }
            // nothing blocked by the meeting rule any more and still no taker: at most one team is short
            if (accepted == 0 && cycle >= tally.maxMeetings()) break;
        }
        return picked;
    }

    /**
     * Handles the leftover case of a single team still short of the target while every other team
     * is full: a new pairing (a, b) not involving that team is replaced by (team, a) and (team, b).
     */
    private void repairLoneDeficit(League league, List<Team> teams, Tally tally, int target,
                                   List<RoundRobinScheduler.Pairing> picked) {
        List<Team> behind = teams.stream().filter(t -> tally.games(t.id()) < target).toList();
        if (behind.isEmpty()) return;
        if (behind.size() > 1) {
            throw new IllegalStateException("Unpaired teams left over for league " + league.id() + ": " + behind);
        }
        Team lone = behind.get(0);
        int missing = target - tally.games(lone.id());
        if (missing % 2 != 0) {
            throw new UnfairScheduleException("League " + league.name() + ": team " + lone.name()
                    + " needs an odd number of extra matches (" + missing + ") that no opponent can absorb");
        }
        while (tally.games(lone.id()) < target) {
            int idx = lastIndexNotInvolving(picked, lone.id());
            if (idx < 0) {
                throw new UnfairScheduleException("League " + league.name() + ": cannot give team "
                        + lone.name() + " " + missing + " more match(es) without exceeding the target elsewhere");
            }
            var removed = picked.remove(idx);
            tally.unplay(removed.first().id(), removed.second().id());
            picked.add(new RoundRobinScheduler.Pairing(lone, removed.first()));
            picked.add(new RoundRobinScheduler.Pairing(lone, removed.second()));
            tally.play(lone.id(), removed.first().id());
            tally.play(lone.id(), removed.second().id());
        }
    }

    private static int lastIndexNotInvolving(List<RoundRobinScheduler.Pairing> picked, long teamId) {
        for (int i = picked.size() - 1; i >= 0; i--) {
            var p = picked.get(i);
            if (p.first().id() != teamId && p.second().id() != teamId) return i;
        }
        return -1;
    }

    /** Running per-team and per-pair counts, seeded from the league's existing matches. */
    private static final class Tally {
        final Map<Long, Integer> games = new HashMap<>();
        final Map<Long, Integer> homes = new HashMap<>();
        final Map<PairKey, Integer> meetings = new HashMap<>();
        final Map<PairKey, Long> lastHost = new HashMap<>();
        final Set<Long> teamIds = new HashSet<>();

        Tally(League league, List<Team> teams, List<Match> existing) {
            for (Team t : teams) {
                if (t.leagueId() != league.id()) {
                    throw new IllegalArgumentException("Team " + t.name() + " is not in league " + league.id());
                }
                if (!teamIds.add(t.id())) throw new IllegalArgumentException("Duplicate team id " + t.id());
            }
            existing.stream()
                    .sorted(Comparator.comparingLong(Match::id))
                    .filter(m -> teamIds.contains(m.homeTeam().id()) && teamIds.contains(m.visitorTeam().id()))
                    .forEach(m -> {
                        long h = m.homeTeam().id();
                        long v = m.visitorTeam().id();
                        play(h, v);
                        homes.merge(h, 1, Integer::sum);
                        lastHost.put(PairKey.of(h, v), h);
                    });
        }

        int games(long teamId) { return games.getOrDefault(teamId, 0); }

        int meetings(long a, long b) { return meetings.getOrDefault(PairKey.of(a, b), 0); }

        int maxMeetings() {
            return meetings.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        }

        boolean allReached(int target) {
            return teamIds.stream().allMatch(id -> games(id) >= target);
        }

        void play(long a, long b) {
            games.merge(a, 1, Integer::sum);
            games.merge(b, 1, Integer::sum);
            meetings.merge(PairKey.of(a, b), 1, Integer::sum);
        }

        void unplay(long a, long b) {
            games.merge(a, -1, Integer::sum);
            games.merge(b, -1, Integer::sum);
            meetings.merge(PairKey.of(a, b), -1, Integer::sum);
        }
    }
}
