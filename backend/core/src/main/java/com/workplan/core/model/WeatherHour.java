package com.workplan.core.model;

import java.time.Instant;
import java.util.Objects;

public record WeatherHour(
        double tempF,
        String condition,
        double precipProb,
        double windMph,
        Instant timestamp
) {
    public WeatherHour {
        Objects.requireNonNull(timestamp, "timestamp is required");
        condition = condition == null ? "" : condition;
        if (precipProb < 0.0 || precipProb > 1.0) {
            throw new IllegalArgumentException("precipProb must be within [0, 1]: " + precipProb);
        }
    }
}
