package com.workplan.core.events;

import java.time.Instant;

public record PlanRefreshFailed(
        Instant timestamp,
        String workerId,
        long generation,
        String message
) implements Event {
    @Override
    public String type() {
        return "PlanRefreshFailed";
    }
}
