package com.gnovoa.tennis.runner;

import static com.gnovoa.tennis.TestData.*;
import static org.assertj.core.api.Assertions.assertThatPredicate;

import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.Match;
import java.time.DayOfWeek;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchFilterTest {

  private final Facility courts = facility(1, DayOfWeek.MONDAY, slot("18:30", 4));

  private Match scheduledMatch() {
    Match m = new Match(123456, league(3, 2, 1, false), team(1, 3, 1), team(2, 3, 1));
    m.assign(courts, MONDAY, List.of(t("18:30")), null);
    return m;
  }

  @Test
  void emptyFilterMatchesEverything() {
    assertThatPredicate(new MatchFilter(null, null, null, " ")).accepts(scheduledMatch());
  }

  @Test
  void everySearchTermMustMatch() {
    Match m = scheduledMatch();

    assertThatPredicate(new MatchFilter(null, null, null, "team 1 facility")).accepts(m);
    assertThatPredicate(new MatchFilter(null, null, null, "18:30 2025-04-07")).accepts(m);
    assertThatPredicate(new MatchFilter(null, null, null, "123456")).accepts(m);
    assertThatPredicate(new MatchFilter(null, null, null, "team nowhere")).rejects(m);
  }

  @Test
  void leagueAndDateBoundsApply() {
    Match m = scheduledMatch();

    assertThatPredicate(new MatchFilter(3L, MONDAY, MONDAY, null)).accepts(m);
    assertThatPredicate(new MatchFilter(4L, null, null, null)).rejects(m);
    assertThatPredicate(new MatchFilter(null, MONDAY.plusDays(1), null, null)).rejects(m);
    assertThatPredicate(new MatchFilter(null, null, MONDAY.minusDays(1), null)).rejects(m);
    assertThatPredicate(new MatchFilter(null, MONDAY, null, null))
        .rejects(new Match(1, league(3, 2, 1, false), team(1, 3, 1), team(2, 3, 1)));
  }
}
