package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;

import java.util.Optional;

public interface BuildingResolutionStrategy {
    String id();

    Optional<BuildingSummary> resolve(WorkerState state);
}
