package com.workplan.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record WeatherSnapshot(WeatherHour current, List<WeatherHour> hourly) {
    public WeatherSnapshot {
        Objects.requireNonNull(current, "current is required");
        hourly = hourly == null ? List.of() : List.copyOf(hourly);
    }

    public List<WeatherHour> lookahead(int hours) {
        if (hourly.isEmpty()) {
            return List.of(current);
        }
        return hourly.subList(0, Math.min(Math.max(hours, 1), hourly.size()));
    }

    public Instant referenceTime() {
        return current.timestamp();
    }
}
