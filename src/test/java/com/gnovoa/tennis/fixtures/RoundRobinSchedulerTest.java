package com.gnovoa.tennis.fixtures;

import static com.gnovoa.tennis.TestData.teams;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tennis.model.Team;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RoundRobinSchedulerTest {

  private final RoundRobinScheduler scheduler = new RoundRobinScheduler();

  @Test
  void evenTeamCountGivesPerfectRounds() {
    List<Team> teams = teams(1, 6, 1);

    var rounds = scheduler.singleRoundRobin(teams);

    assertThat(rounds).hasSize(5);
    for (var round : rounds) {
      assertThat(round.pairings()).hasSize(3);
      Set<Long> seen = new HashSet<>();
      round.pairings().forEach(p -> {
        assertThat(seen.add(p.first().id())).isTrue();
        assertThat(seen.add(p.second().id())).isTrue();
      });
    }
    assertEveryPairExactlyOnce(teams, rounds);
  }

  @Test
  void oddTeamCountGivesEachTeamOneBye() {
    List<Team> teams = teams(1, 5, 1);

    var rounds = scheduler.singleRoundRobin(teams);

    assertThat(rounds).hasSize(5);
    Map<Long, Integer> sitOuts = new HashMap<>();
    for (var round : rounds) {
      assertThat(round.pairings()).hasSize(2);
      Set<Long> playing = new HashSet<>();
      round.pairings().forEach(p -> {
        playing.add(p.first().id());
        playing.add(p.second().id());
      });
      teams.stream().filter(t -> !playing.contains(t.id())).forEach(t -> sitOuts.merge(t.id(), 1, Integer::sum));
    }
    assertThat(sitOuts).hasSize(5).allSatisfy((id, n) -> assertThat(n).isEqualTo(1));
    assertEveryPairExactlyOnce(teams, rounds);
  }

  @Test
  void rejectsFewerThanTwoTeams() {
    assertThatThrownBy(() -> scheduler.singleRoundRobin(teams(1, 1, 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static void assertEveryPairExactlyOnce(List<Team> teams, List<RoundRobinScheduler.Round> rounds) {
    Map<PairKey, Integer> count = new HashMap<>();
    rounds.forEach(r -> r.pairings().forEach(p -> count.merge(PairKey.of(p.first().id(), p.second().id()), 1, Integer::sum)));
    int n = teams.size();
    assertThat(count).hasSize(n * (n - 1) / 2);
    assertThat(count.values()).containsOnly(1);
  }
}
