package com.gnovoa.tennis.store;

import static com.gnovoa.tennis.TestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.Team;
import java.time.DayOfWeek;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class InMemoryLeagueDataStoreTest {

  private final InMemoryLeagueDataStore store = new InMemoryLeagueDataStore();
  private final League league = league(1, 2, 1, false);

  private Match match(long id) {
    return new Match(id, league, team(1, 1, 1), team(2, 1, 1));
  }

  @Test
  void listingsAreOrderedById() {
    store.createMatch(match(30));
    store.createMatch(match(10));
    store.createMatch(match(20));

    assertThat(store.allMatches()).extracting(Match::id).containsExactly(10L, 20L, 30L);
    assertThat(store.matchesByLeague(1)).extracting(Match::id).containsExactly(10L, 20L, 30L);
    assertThat(store.matchesByLeague(2)).isEmpty();
  }

  @Test
  void duplicateIdsAreRejected() {
    store.createMatch(match(10));

    assertThatThrownBy(() -> store.createMatch(match(10))).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void updateCopiesTheSchedulingFieldsOfADetachedMatch() {
    Facility courts = facility(1, DayOfWeek.MONDAY, slot("09:00", 4));
    store.createMatch(match(10));
    Match detached = match(10);
    detached.assign(courts, MONDAY, List.of(t("09:00")), null);

    store.updateMatch(detached);

    Match stored = store.match(10).orElseThrow();
    assertThat(stored).isNotSameAs(detached);
    assertThat(stored.assignment()).isEqualTo(detached.assignment());
  }

  @Test
  void missingMatchesCannotBeUpdatedOrDeleted() {
    assertThatThrownBy(() -> store.updateMatch(match(10))).isInstanceOf(NoSuchElementException.class);
    assertThatThrownBy(() -> store.deleteMatch(10)).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void teamsAreListedPerLeague() {
    store.saveTeam(team(3, 1, 1));
    store.saveTeam(team(1, 1, 1));
    store.saveTeam(team(2, 2, 1));

    assertThat(store.teamsByLeague(1)).extracting(Team::id).containsExactly(1L, 3L);
  }
}
