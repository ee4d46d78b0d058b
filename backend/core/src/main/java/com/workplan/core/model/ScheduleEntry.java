package com.workplan.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

public record ScheduleEntry(
        String id,
        String buildingId,
        String circuitId,
        String title,
        String category,
        Instant startTime,
        Instant endTime,
        int taskCount,
        Urgency urgency,
        EntryOrigin origin,
        boolean requiresPhoto
) {
    public ScheduleEntry(
            String id,
            String buildingId,
            String circuitId,
            String title,
            String category,
            Instant startTime,
            Instant endTime,
            int taskCount,
            Urgency urgency,
            EntryOrigin origin
    ) {
        this(id, buildingId, circuitId, title, category, startTime, endTime, taskCount, urgency, origin, false);
    }

    public ScheduleEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(startTime, "startTime is required");
        Objects.requireNonNull(endTime, "endTime is required");
        Objects.requireNonNull(origin, "origin is required");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime before startTime for entry " + id);
        }
        if (taskCount < 1) {
            throw new IllegalArgumentException("taskCount must be positive for entry " + id);
        }
        buildingId = buildingId == null ? "" : buildingId;
        category = category == null ? "" : category;
        urgency = urgency == null ? Urgency.NORMAL : urgency;
    }

    public boolean isAttributed() {
        return !buildingId.isBlank();
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(startTime) && !instant.isAfter(endTime);
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    public double durationHours() {
        return duration().toSeconds() / 3600.0;
    }

    public DedupKey dedupKey() {
        String attribution = circuitId == null ? buildingId : circuitId + "/" + buildingId;
        return new DedupKey(
                attribution,
                title.trim().toLowerCase(Locale.ROOT),
                startTime.truncatedTo(ChronoUnit.MINUTES)
        );
    }

    public ScheduleEntry withEnd(Instant end, int count, Urgency mergedUrgency) {
        return new ScheduleEntry(id, buildingId, circuitId, title, category, startTime, end, count, mergedUrgency, origin, requiresPhoto);
    }

    public ScheduleEntry withRequiresPhoto(boolean value) {
        return new ScheduleEntry(id, buildingId, circuitId, title, category, startTime, endTime, taskCount, urgency, origin, value);
    }

    public Task toTask() {
        return new Task(
                id,
                title,
                isAttributed() ? buildingId : null,
                startTime,
                urgency,
                false,
                category,
                requiresPhoto,
                duration()
        );
    }

    public record DedupKey(String attribution, String normalizedTitle, Instant minute) {
    }
}
