package com.workplan.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record CheckIn(BuildingSummary building, Instant checkedInAt, Instant expiresAt) {
    public CheckIn {
        Objects.requireNonNull(building, "building is required");
        Objects.requireNonNull(checkedInAt, "checkedInAt is required");
    }

    public boolean isActiveAt(Instant now, Duration maxAge) {
        if (now.isBefore(checkedInAt)) {
            return false;
        }
        if (expiresAt != null && !now.isBefore(expiresAt)) {
            return false;
        }
        return maxAge == null || Duration.between(checkedInAt, now).compareTo(maxAge) < 0;
    }
}
