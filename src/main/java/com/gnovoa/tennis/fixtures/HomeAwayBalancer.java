package com.gnovoa.tennis.fixtures;

import com.gnovoa.tennis.model.Team;

import java.util.*;

/**
 * Chooses the host of each new pairing and then evens out home counts.
 *
 * <p>First pass, pairing by pairing: a pair that met before swaps hosts; otherwise the team with
 * fewer home games hosts, lower team id on a tie. Second pass: while some team has at least two
 * more home games than a team it can reach through a chain of new pairings (host to visitor), the
 * chain is reversed. Reversing a chain moves one home game from its start to its end and leaves
 * everybody in between unchanged, so the pass terminates. When every team plays the same number of
 * games and all pairings are new, home counts end up within one of each other.
 */
final class HomeAwayBalancer {

    /** A pairing with its host decided. Mutable only while balancing. */
    static final class Oriented {
        Team home;
        Team away;

        Oriented(Team home, Team away) {
            this.home = home;
            this.away = away;
        }

        void flip() {
            Team t = home;
            home = away;
            away = t;
        }
    }

    private final Map<Long, Integer> homeCounts;
    private final Map<PairKey, Long> lastHost;

    /**
     * @param homeCounts home games already held per team id (existing matches)
     * @param lastHost host of the most recent existing meeting per pair
     */
    HomeAwayBalancer(Map<Long, Integer> homeCounts, Map<PairKey, Long> lastHost) {
        this.homeCounts = new HashMap<>(homeCounts);
        this.lastHost = new HashMap<>(lastHost);
    }

    List<Oriented> orient(List<RoundRobinScheduler.Pairing> pairings) {
        List<Oriented> out = new ArrayList<>(pairings.size());
        for (var p : pairings) {
            Oriented o = initial(p.first(), p.second());
            homeCounts.merge(o.home.id(), 1, Integer::sum);
            lastHost.put(PairKey.of(o.home.id(), o.away.id()), o.home.id());
            out.add(o);
        }
        balance(out);
        return out;
    }

    private Oriented initial(Team a, Team b) {
        Long previousHost = lastHost.get(PairKey.of(a.id(), b.id()));
        if (previousHost != null) {
            return previousHost == a.id() ? new Oriented(b, a) : new Oriented(a, b);
        }
        int ha = homes(a.id());
        int hb = homes(b.id());
        if (ha != hb) return ha < hb ? new Oriented(a, b) : new Oriented(b, a);
        return a.id() < b.id() ? new Oriented(a, b) : new Oriented(b, a);
    }

    private void balance(List<Oriented> edges) {
        while (flipOneChain(edges)) {
            // keep going until no chain improves the spread
        }
    }

    private boolean flipOneChain(List<Oriented> edges) {
        Map<Long, List<Oriented>> outgoing = new TreeMap<>();
        for (Oriented e : edges) outgoing.computeIfAbsent(e.home.id(), k -> new ArrayList<>()).add(e);

        List<Long> sources = new ArrayList<>(outgoing.keySet());
        sources.sort(Comparator.comparingInt((Long id) -> homes(id)).reversed().thenComparing(id -> id));

        for (long source : sources) {
            List<Oriented> path = shortestPathToLighterHost(source, outgoing);
            if (path != null) {
                path.forEach(Oriented::flip);
                homeCounts.merge(source, -1, Integer::sum);
                homeCounts.merge(path.get(path.size() - 1).home.id(), 1, Integer::sum);
                return true;
            }
        }
        return false;
    }

    /** BFS along host-to-visitor edges for the nearest team with at least two fewer home games. */
    private List<Oriented> shortestPathToLighterHost(long source, Map<Long, List<Oriented>> outgoing) {
        int sourceHomes = homes(source);
        Map<Long, Oriented> reachedVia = new HashMap<>();
        Deque<Long> queue = new ArrayDeque<>();
        queue.add(source);
        reachedVia.put(source, null);

        while (!queue.isEmpty()) {
            long node = queue.poll();
            for (Oriented e : outgoing.getOrDefault(node, List.of())) {
                long next = e.away.id();
                if (reachedVia.containsKey(next)) continue;
                reachedVia.put(next, e);
                if (sourceHomes - homes(next) >= 2) {
                    LinkedList<Oriented> path = new LinkedList<>();
                    for (long at = next; at != source; at = reachedVia.get(at).home.id()) {
                        path.addFirst(reachedVia.get(at));
                    }
                    return path;
                }
                queue.add(next);
            }
        }
        return null;
    }

    private int homes(long teamId) {
        return homeCounts.getOrDefault(teamId, 0);
    }
}
