package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.ScheduleEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

public final class UpcomingWindowStrategy implements BuildingResolutionStrategy {
    public static final String ID = "upcoming-window";

    private final Duration window;

    public UpcomingWindowStrategy(Duration window) {
        this.window = window;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<BuildingSummary> resolve(WorkerState state) {
        Instant now = state.now();
        Instant horizon = now.plus(window);
        return state.todaySchedule().stream()
                .filter(ScheduleEntry::isAttributed)
                .filter(entry -> entry.startTime().isAfter(now) && !entry.startTime().isAfter(horizon))
                .min(Comparator.comparing(ScheduleEntry::startTime).thenComparing(ScheduleEntry::title))
                .map(entry -> state.buildingFor(entry.buildingId()));
    }
}
