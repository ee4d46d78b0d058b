package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;
import com.workplan.core.model.Coordinate;
import com.workplan.core.model.ScheduleEntry;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record WorkerState(
        String workerId,
        Instant now,
        CheckIn explicitCheckIn,
        List<ScheduleEntry> todaySchedule,
        Coordinate livePosition,
        List<BuildingSummary> assignedBuildings
) {
    public WorkerState {
        Objects.requireNonNull(now, "now is required");
        todaySchedule = todaySchedule == null ? List.of() : List.copyOf(todaySchedule);
        assignedBuildings = assignedBuildings == null ? List.of() : List.copyOf(assignedBuildings);
    }

    public Optional<BuildingSummary> assignedBuilding(String buildingId) {
        return assignedBuildings.stream().filter(building -> building.id().equals(buildingId)).findFirst();
    }

    public BuildingSummary buildingFor(String buildingId) {
        return assignedBuilding(buildingId).orElseGet(() -> BuildingSummary.placeholder(buildingId));
    }
}
