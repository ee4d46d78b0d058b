package com.workplan.core.events;

import java.time.Instant;

public record CurrentBuildingChanged(
        Instant timestamp,
        String workerId,
        String previousBuildingId,
        String buildingId,
        String resolvedBy
) implements Event {
    @Override
    public String type() {
        return "CurrentBuildingChanged";
    }
}
