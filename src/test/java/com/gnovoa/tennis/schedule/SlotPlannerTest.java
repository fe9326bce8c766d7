package com.gnovoa.tennis.schedule;

import static com.gnovoa.tennis.TestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tennis.error.CapacityException;
import com.gnovoa.tennis.error.InsufficientCapacityException;
import com.gnovoa.tennis.error.NoSingleSlotException;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.TimeSlot;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SlotPlannerTest {

  private final SlotPlanner planner = new SlotPlanner();

  private static Match match(boolean allowSplitLines) {
    League league = league(1, 4, 3, allowSplitLines);
    return new Match(1, league, team(1, 1, 1), team(2, 1, 1));
  }

  @Test
  void autoPicksTheOnlySlotThatFitsAllLines() {
    List<TimeSlot> open = List.of(slot("09:00", 2), slot("10:30", 4));

    List<LocalTime> times = planner.plan(match(false), 3, SchedulingOptions.auto(), open);

    assertThat(times).containsExactly(t("10:30"), t("10:30"), t("10:30"));
  }

  @Test
  void autoWithoutSplitLinesFailsWhenNoSingleSlotFits() {
    List<TimeSlot> open = List.of(slot("09:00", 2));

    assertThatThrownBy(() -> planner.plan(match(false), 3, SchedulingOptions.auto(), open))
        .isInstanceOf(NoSingleSlotException.class);
  }

  @Test
  void autoWithSplitLinesPacksEarliestSlotsFirst() {
    List<TimeSlot> open = List.of(slot("09:00", 2), slot("10:30", 1), slot("12:00", 5));

    assertThat(planner.plan(match(true), 3, SchedulingOptions.auto(), open))
        .containsExactly(t("09:00"), t("09:00"), t("10:30"));
  }

  @Test
  void autoWithSplitLinesPrefersOneSlotWhenAvailable() {
    List<TimeSlot> open = List.of(slot("09:00", 1), slot("10:30", 3));

    assertThat(planner.plan(match(true), 3, SchedulingOptions.auto(), open))
        .containsExactly(t("10:30"), t("10:30"), t("10:30"));
  }

  @Test
  void autoWithSplitLinesFailsWhenTheDayIsTooSmall() {
    List<TimeSlot> open = List.of(slot("09:00", 1), slot("10:30", 1));

    assertThatThrownBy(() -> planner.plan(match(true), 3, SchedulingOptions.auto(), open))
        .isInstanceOf(InsufficientCapacityException.class);
  }

  @Test
  void sameUsesTheGivenTimeForEveryLine() {
    List<TimeSlot> open = List.of(slot("09:00", 2), slot("10:30", 4));

    assertThat(planner.plan(match(false), 3, SchedulingOptions.same(t("10:30")), open))
        .containsExactly(t("10:30"), t("10:30"), t("10:30"));
    assertThatThrownBy(() -> planner.plan(match(false), 3, SchedulingOptions.same(t("09:00")), open))
        .isInstanceOf(CapacityException.class);
    assertThatThrownBy(() -> planner.plan(match(false), 3, SchedulingOptions.same(t("11:00")), open))
        .isInstanceOf(CapacityException.class);
  }

  @Test
  void customClaimsOneCourtPerLineAndNamesTheOverSubscribedTime() {
    List<TimeSlot> open = List.of(slot("09:00", 2), slot("10:30", 4));

    assertThat(planner.plan(match(true), 3, SchedulingOptions.custom(List.of(t("10:30"), t("09:00"), t("09:00"))), open))
        .containsExactly(t("09:00"), t("09:00"), t("10:30"));
    assertThatThrownBy(() -> planner.plan(match(true), 3,
        SchedulingOptions.custom(List.of(t("09:00"), t("09:00"), t("09:00"))), open))
        .isInstanceOf(CapacityException.class)
        .hasMessageContaining("09:00");
  }

  @Test
  void customNeedsOneTimePerLine() {
    List<TimeSlot> open = List.of(slot("09:00", 4));

    assertThatThrownBy(() -> planner.plan(match(true), 3, SchedulingOptions.custom(List.of(t("09:00"))), open))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void customCannotSplitLinesWhenTheLeagueForbidsIt() {
    List<TimeSlot> open = List.of(slot("09:00", 4), slot("10:30", 4));

    assertThatThrownBy(() -> planner.plan(match(false), 3,
        SchedulingOptions.custom(List.of(t("09:00"), t("09:00"), t("10:30"))), open))
        .isInstanceOf(NoSingleSlotException.class);
  }

  @Test
  void partialModeAssignsNoTimes() {
    assertThat(planner.plan(match(false), 3, SchedulingOptions.partialOnly(), List.of())).isEmpty();
  }
}
