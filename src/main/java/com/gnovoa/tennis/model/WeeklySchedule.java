package com.gnovoa.tennis.model;

import java.time.DayOfWeek;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly template of start times for a facility.
 *
 * <p>Days missing from the map have no slots. Slots are kept ordered by time.
 */
public record WeeklySchedule(Map<DayOfWeek, List<TimeSlot>> days) {

    public WeeklySchedule {
        Map<DayOfWeek, List<TimeSlot>> copy = new EnumMap<>(DayOfWeek.class);
        if (days != null) {
            days.forEach((day, slots) -> copy.put(day, slots == null ? List.of() : slots.stream()
                    .sorted(Comparator.comparing(TimeSlot::time))
                    .toList()));
        }
        days = Map.copyOf(copy);
    }

    public static WeeklySchedule empty() {
        return new WeeklySchedule(Map.of());
    }

    public List<TimeSlot> slotsFor(DayOfWeek day) {
        return days.getOrDefault(day, List.of());
    }
}
