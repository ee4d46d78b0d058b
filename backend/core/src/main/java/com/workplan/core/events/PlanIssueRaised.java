package com.workplan.core.events;

import java.time.Instant;
import java.util.Map;

public record PlanIssueRaised(
        Instant timestamp,
        String workerId,
        String kind,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "PlanIssueRaised";
    }
}
