package com.gnovoa.tennis.schedule;

import static com.gnovoa.tennis.TestData.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tennis.model.Facility;
import java.time.DayOfWeek;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AvailabilityModelTest {

  private final AvailabilityModel model = new AvailabilityModel();

  @Test
  void returnsTheWeekdaySlotsInTimeOrder() {
    Facility f = facility(1, DayOfWeek.MONDAY, slot("18:00", 12), slot("09:00", 8), slot("19:30", 10));

    assertThat(model.availability(f, MONDAY))
        .containsExactly(slot("09:00", 8), slot("18:00", 12), slot("19:30", 10));
  }

  @Test
  void blackoutDateHasNoSlots() {
    Facility f = facility(1, DayOfWeek.MONDAY, Set.of(MONDAY), slot("09:00", 8));

    assertThat(model.availability(f, MONDAY)).isEmpty();
    assertThat(model.availability(f, MONDAY.plusWeeks(1))).hasSize(1);
  }

  @Test
  void dayWithoutTemplateHasNoSlots() {
    Facility f = facility(1, DayOfWeek.MONDAY, slot("09:00", 8));

    assertThat(model.availability(f, MONDAY.plusDays(1))).isEmpty();
  }
}
