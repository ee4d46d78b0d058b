package com.workplan.core.model;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record WeeklyPlan(List<DaySchedule> days) {
    public WeeklyPlan {
        days = days == null ? List.of() : List.copyOf(days);
        Set<LocalDate> seen = new HashSet<>();
        for (DaySchedule day : days) {
            if (!seen.add(day.date())) {
                throw new IllegalArgumentException("Duplicate day in weekly plan: " + day.date());
            }
        }
    }

    public Optional<DaySchedule> day(LocalDate date) {
        return days.stream().filter(day -> day.date().equals(date)).findFirst();
    }

    public double totalHours() {
        return days.stream().mapToDouble(DaySchedule::totalHours).sum();
    }
}
