package com.workplan.planner.weather;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record WeatherSuggestion(
        String id,
        SuggestionKind kind,
        String title,
        String subtitle,
        String rationale,
        List<String> checklist,
        String buildingId,
        Instant dueBy
) {
    public WeatherSuggestion {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(title, "title is required");
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
    }
}
