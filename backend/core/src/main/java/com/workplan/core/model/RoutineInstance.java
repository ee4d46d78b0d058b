package com.workplan.core.model;

import java.time.Instant;
import java.util.Objects;

public record RoutineInstance(
        String id,
        String buildingId,
        String title,
        String category,
        Instant startTime,
        Instant endTime
) {
    public RoutineInstance {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(startTime, "startTime is required");
        buildingId = buildingId == null ? "" : buildingId;
        category = category == null ? "" : category;
    }
}
