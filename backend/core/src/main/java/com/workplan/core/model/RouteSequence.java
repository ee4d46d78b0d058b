package com.workplan.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

public record RouteSequence(
        String buildingId,
        String buildingName,
        LocalTime arrivalTime,
        Duration estimatedDuration,
        List<RouteOperation> operations
) {
    public RouteSequence {
        Objects.requireNonNull(buildingId, "buildingId is required");
        Objects.requireNonNull(arrivalTime, "arrivalTime is required");
        buildingName = buildingName == null ? buildingId : buildingName;
        estimatedDuration = estimatedDuration == null || estimatedDuration.isNegative()
                ? Duration.ZERO
                : estimatedDuration;
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public Instant arrivalOn(LocalDate date, ZoneId zone) {
        return date.atTime(arrivalTime).atZone(zone).toInstant();
    }

    public boolean windowContains(LocalDate date, ZoneId zone, Instant instant) {
        Instant start = arrivalOn(date, zone);
        Instant end = start.plus(estimatedDuration);
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
