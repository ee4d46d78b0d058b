package com.workplan.planner.weather;

import com.workplan.core.model.Task;

import java.util.Objects;

public record ScoredTask(Task task, int score, WeatherChip chip, String advice, boolean outdoor) {
    public ScoredTask {
        Objects.requireNonNull(task, "task is required");
    }
}
