package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;

import java.util.Optional;

public final class AssignedFallbackStrategy implements BuildingResolutionStrategy {
    public static final String ID = "assigned-fallback";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<BuildingSummary> resolve(WorkerState state) {
        if (state.assignedBuildings().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(state.assignedBuildings().get(0));
    }
}
