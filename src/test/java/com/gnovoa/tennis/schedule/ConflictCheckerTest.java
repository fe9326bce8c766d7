package com.gnovoa.tennis.schedule;

import static com.gnovoa.tennis.TestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tennis.config.SchedulerProperties;
import com.gnovoa.tennis.error.ConflictException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.store.InMemoryLeagueDataStore;
import java.time.DayOfWeek;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConflictCheckerTest {

  private final InMemoryLeagueDataStore store = new InMemoryLeagueDataStore();
  private final ConflictChecker checker =
      new ConflictChecker(new AvailabilityModel(), store, SchedulerProperties.defaults());

  private final League league = league(1, 4, 2, true);
  private final Facility courts = facility(1, DayOfWeek.MONDAY, slot("09:00", 4), slot("13:00", 4));
  private final Facility otherCourts = facility(2, DayOfWeek.MONDAY, slot("09:00", 4), slot("13:00", 4));

  private Match booked;

  @BeforeEach
  void setUp() {
    booked = new Match(1, league, team(1, 1, 1), team(2, 1, 1));
    booked.assign(courts, MONDAY, List.of(t("09:00"), t("09:00")), null);
    store.createMatch(booked);
  }

  @Test
  void bookedLinesReduceRemainingCourts() {
    assertThat(checker.remainingAvailability(courts, MONDAY, 99))
        .containsExactly(slot("09:00", 2), slot("13:00", 4));
    assertThat(checker.remainingAvailability(otherCourts, MONDAY, 99))
        .containsExactly(slot("09:00", 4), slot("13:00", 4));
  }

  @Test
  void aMatchDoesNotCompeteWithItsOwnBooking() {
    assertThat(checker.remainingAvailability(courts, MONDAY, booked.id()))
        .containsExactly(slot("09:00", 4), slot("13:00", 4));
  }

  @Test
  void exceedingASlotIsAConflict() {
    Match m = new Match(2, league, team(3, 1, 1), team(4, 1, 1));

    assertThatCode(() -> checker.verify(m, courts, MONDAY, List.of(t("09:00"), t("09:00"))))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> checker.verify(m, courts, MONDAY, List.of(t("09:00"), t("09:00"), t("09:00"))))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void teamCannotPlayTwoOverlappingMatches() {
    Match sameTeamElsewhere = new Match(2, league, team(1, 1, 1), team(3, 1, 1));

    assertThatThrownBy(() -> checker.verify(sameTeamElsewhere, otherCourts, MONDAY, List.of(t("09:00"))))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("Team 1");
    assertThatCode(() -> checker.verify(sameTeamElsewhere, otherCourts, MONDAY, List.of(t("13:00"))))
        .doesNotThrowAnyException();
    assertThatCode(() -> checker.verify(sameTeamElsewhere, otherCourts, MONDAY.plusWeeks(1), List.of(t("09:00"))))
        .doesNotThrowAnyException();
  }

  @Test
  void placementWithoutTimesBlocksTheWholeDay() {
    Match placed = new Match(3, league, team(5, 1, 1), team(6, 1, 1));
    placed.assign(otherCourts, MONDAY, List.of(), null);
    store.createMatch(placed);
    Match laterSameDay = new Match(4, league, team(5, 1, 1), team(7, 1, 1));

    assertThatThrownBy(() -> checker.verify(laterSameDay, courts, MONDAY, List.of(t("13:00"))))
        .isInstanceOf(ConflictException.class);
  }
}
