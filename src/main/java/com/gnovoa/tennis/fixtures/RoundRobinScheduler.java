package com.gnovoa.tennis.fixtures;

import com.gnovoa.tennis.model.Team;

import java.util.*;

/**
 * Builds single round-robin rounds for any number of teams using the circle method.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>every unordered pair of teams appears exactly once across the rounds</li>
 *   <li>with an even team count each round is a perfect matching ({@code n - 1} rounds)</li>
 *   <li>with an odd team count a {@link Bye} joins the circle, giving {@code n} rounds in which
 *       each team sits out exactly once</li>
 * </ul>
 *
 * <p>The output is fully deterministic for a given team order.
 */
public final class RoundRobinScheduler {

    /** A position in the circle: a real team, or the bye placeholder. */
    public sealed interface Slot permits RealTeam, Bye {}

    public record RealTeam(Team team) implements Slot {}

    public enum Bye implements Slot { INSTANCE }

    /** Two teams meeting in a round. Which one hosts is decided by the caller. */
    public record Pairing(Team first, Team second) {}

    /** A round with every real pairing; bye pairings are already filtered out. */
    public record Round(int roundIndex, List<Pairing> pairings) {}

    /**
     * Generates a single round-robin.
     *
     * @param teams at least two teams; order determines the rotation
     * @return {@code n - 1} rounds for even n, {@code n} rounds for odd n
     * @throws IllegalArgumentException if fewer than two teams are given
     */
    public List<Round> singleRoundRobin(List<Team> teams) {
        if (teams.size() < 2) throw new IllegalArgumentException("Expected at least 2 teams");

        List<Slot> list = new ArrayList<>(teams.size() + 1);
        for (Team t : teams) list.add(new RealTeam(t));
        if (list.size() % 2 == 1) list.add(Bye.INSTANCE);

        int size = list.size();
        int perRound = size / 2;
        Slot fixed = list.remove(0);
        int n = list.size(); // size - 1, odd

        List<Round> rounds = new ArrayList<>(size - 1);

        for (int round = 0; round < size - 1; round++) {
            List<Slot> left = new ArrayList<>();
            List<Slot> right = new ArrayList<>();

            left.add(fixed);
            left.addAll(list.subList(0, n / 2));

            right.addAll(list.subList(n / 2, n));
            Collections.reverse(right);

            List<Pairing> pairings = new ArrayList<>(perRound);
            for (int i = 0; i < perRound; i++) {
                if (left.get(i) instanceof RealTeam a && right.get(i) instanceof RealTeam b) {
                    pairings.add(new Pairing(a.team(), b.team()));
                }
            }

            rounds.add(new Round(round + 1, List.copyOf(pairings)));

            Slot last = list.remove(list.size() - 1);
            list.add(0, last);
        }

        return rounds;
    }
}
