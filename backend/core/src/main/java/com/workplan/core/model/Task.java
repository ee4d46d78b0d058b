package com.workplan.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record Task(
        String id,
        String title,
        String buildingId,
        Instant dueTime,
        Urgency urgency,
        boolean completed,
        String category,
        boolean requiresPhoto,
        Duration estimatedDuration
) {
    public Task {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        urgency = urgency == null ? Urgency.NORMAL : urgency;
        category = category == null ? "" : category;
    }

    public boolean hasBuilding() {
        return buildingId != null && !buildingId.isBlank();
    }

    public TaskCategory taskCategory() {
        return TaskCategory.fromLabel(category);
    }

    public Task withRequiresPhoto(boolean value) {
        return new Task(id, title, buildingId, dueTime, urgency, completed, category, value, estimatedDuration);
    }
}
