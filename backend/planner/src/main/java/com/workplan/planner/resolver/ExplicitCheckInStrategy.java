package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;

import java.time.Duration;
import java.util.Optional;

public final class ExplicitCheckInStrategy implements BuildingResolutionStrategy {
    public static final String ID = "explicit-check-in";

    private final Duration maxAge;

    public ExplicitCheckInStrategy(Duration maxAge) {
        this.maxAge = maxAge;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<BuildingSummary> resolve(WorkerState state) {
        CheckIn checkIn = state.explicitCheckIn();
        if (checkIn == null || !checkIn.isActiveAt(state.now(), maxAge)) {
            return Optional.empty();
        }
        return Optional.of(checkIn.building());
    }
}
