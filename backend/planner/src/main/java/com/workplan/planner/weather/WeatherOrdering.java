package com.workplan.planner.weather;

import java.util.List;

public record WeatherOrdering(
        List<ScoredTask> ordered,
        List<ScoredTask> deferred,
        boolean deferralActive,
        List<WeatherSuggestion> substitutes
) {
    public WeatherOrdering {
        ordered = ordered == null ? List.of() : List.copyOf(ordered);
        deferred = deferred == null ? List.of() : List.copyOf(deferred);
        substitutes = substitutes == null ? List.of() : List.copyOf(substitutes);
    }
}
