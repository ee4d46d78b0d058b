package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;

import java.util.Objects;

public record BuildingResolution(BuildingSummary building, String strategyId) {
    public BuildingResolution {
        Objects.requireNonNull(building, "building is required");
        Objects.requireNonNull(strategyId, "strategyId is required");
    }
}
