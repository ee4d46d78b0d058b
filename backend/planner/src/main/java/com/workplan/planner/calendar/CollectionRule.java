package com.workplan.planner.calendar;

import com.workplan.core.model.Urgency;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record CollectionRule(
        String id,
        String title,
        String appliesToWorker,
        Set<DayOfWeek> collectionDays,
        LocalTime windowStart,
        LocalTime windowEnd,
        List<String> buildingGroup,
        String category,
        Urgency urgency
) {
    public CollectionRule {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(appliesToWorker, "appliesToWorker is required");
        Objects.requireNonNull(windowStart, "windowStart is required");
        Objects.requireNonNull(windowEnd, "windowEnd is required");
        title = title == null || title.isBlank() ? "Collection set-out" : title;
        collectionDays = collectionDays == null ? Set.of() : Set.copyOf(collectionDays);
        buildingGroup = buildingGroup == null ? List.of() : List.copyOf(buildingGroup);
        category = category == null ? "Sanitation" : category;
        urgency = urgency == null ? Urgency.URGENT : urgency;
    }

    public String circuitId() {
        return "circuit:" + id;
    }

    public boolean firesOn(DayOfWeek weekday, String workerId) {
        return collectionDays.contains(weekday) && appliesToWorker.equals(workerId);
    }
}
