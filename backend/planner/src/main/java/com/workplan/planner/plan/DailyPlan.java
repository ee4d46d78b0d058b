package com.workplan.planner.plan;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.WeeklyPlan;
import com.workplan.planner.weather.ScoredTask;
import com.workplan.planner.weather.WeatherSuggestion;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record DailyPlan(
        String workerId,
        LocalDate date,
        Instant generatedAt,
        WeeklyPlan weeklyPlan,
        BuildingSummary currentBuilding,
        String resolvedBy,
        List<BuildingSummary> buildings,
        List<ScoredTask> orderedUpcoming,
        List<ScoredTask> deferredOutdoor,
        List<WeatherSuggestion> suggestions,
        boolean deferralActive,
        List<PlanIssue> issues
) {
    public DailyPlan {
        Objects.requireNonNull(workerId, "workerId is required");
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(weeklyPlan, "weeklyPlan is required");
        buildings = buildings == null ? List.of() : List.copyOf(buildings);
        orderedUpcoming = orderedUpcoming == null ? List.of() : List.copyOf(orderedUpcoming);
        deferredOutdoor = deferredOutdoor == null ? List.of() : List.copyOf(deferredOutdoor);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public Optional<BuildingSummary> current() {
        return Optional.ofNullable(currentBuilding);
    }
}
