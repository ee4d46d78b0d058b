package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.Coordinate;

import java.util.Comparator;
import java.util.Optional;

public final class GpsProximityStrategy implements BuildingResolutionStrategy {
    public static final String ID = "gps-proximity";

    private final double radiusMeters;

    public GpsProximityStrategy(double radiusMeters) {
        this.radiusMeters = radiusMeters;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<BuildingSummary> resolve(WorkerState state) {
        Coordinate position = state.livePosition();
        if (position == null) {
            return Optional.empty();
        }
        return state.assignedBuildings().stream()
                .filter(building -> building.coordinate() != null)
                .map(building -> new Candidate(building, position.distanceMeters(building.coordinate())))
                .filter(candidate -> candidate.distanceMeters() <= radiusMeters)
                .min(Comparator.comparingDouble(Candidate::distanceMeters)
                        .thenComparing(candidate -> candidate.building().id()))
                .map(Candidate::building);
    }

    private record Candidate(BuildingSummary building, double distanceMeters) {
    }
}
