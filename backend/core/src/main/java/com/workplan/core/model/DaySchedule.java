package com.workplan.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

public record DaySchedule(LocalDate date, List<ScheduleEntry> items, double totalHours) {
    public DaySchedule {
        Objects.requireNonNull(date, "date is required");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static DaySchedule of(LocalDate date, List<ScheduleEntry> items) {
        double hours = 0.0;
        for (ScheduleEntry item : items) {
            hours += item.durationHours();
        }
        return new DaySchedule(date, items, hours);
    }

    public static DaySchedule empty(LocalDate date) {
        return new DaySchedule(date, List.of(), 0.0);
    }
}
