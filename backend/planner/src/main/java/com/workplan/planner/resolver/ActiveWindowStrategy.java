package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.ScheduleEntry;

import java.util.Comparator;
import java.util.Optional;

public final class ActiveWindowStrategy implements BuildingResolutionStrategy {
    public static final String ID = "active-window";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<BuildingSummary> resolve(WorkerState state) {
        return state.todaySchedule().stream()
                .filter(ScheduleEntry::isAttributed)
                .filter(entry -> entry.contains(state.now()))
                .min(Comparator.comparing(ScheduleEntry::startTime).thenComparing(ScheduleEntry::title))
                .map(entry -> state.buildingFor(entry.buildingId()));
    }
}
