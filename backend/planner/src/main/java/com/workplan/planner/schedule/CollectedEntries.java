package com.workplan.planner.schedule;

import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.ScheduleEntry;

import java.util.List;

public record CollectedEntries(List<ScheduleEntry> entries, List<PlanIssue> issues) {
    public CollectedEntries {
        entries = entries == null ? List.of() : List.copyOf(entries);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
