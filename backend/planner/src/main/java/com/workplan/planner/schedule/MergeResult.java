package com.workplan.planner.schedule;

import com.workplan.core.model.DaySchedule;
import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.ScheduleEntry;

import java.util.List;
import java.util.Objects;

public record MergeResult(DaySchedule day, List<PlanIssue> issues) {
    public MergeResult {
        Objects.requireNonNull(day, "day is required");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public List<ScheduleEntry> entries() {
        return day.items();
    }
}
