package com.workplan.core.events;

import java.time.Instant;
import java.time.LocalDate;

public record PlanComputed(
        Instant timestamp,
        String workerId,
        LocalDate date,
        long generation,
        String currentBuildingId,
        int upcomingCount,
        int deferredCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "PlanComputed";
    }
}
