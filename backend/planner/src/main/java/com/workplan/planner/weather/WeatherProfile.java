package com.workplan.planner.weather;

import com.workplan.core.model.TaskCategory;

public record WeatherProfile(
        boolean outdoor,
        boolean sensitiveToPrecip,
        boolean sensitiveToWind,
        Double idealWindMax,
        Double idealPrecipProbMax
) {
    private static final WeatherProfile INDOOR = new WeatherProfile(false, false, false, null, null);

    public static WeatherProfile forCategory(TaskCategory category) {
        return switch (category) {
            case CLEANING -> new WeatherProfile(true, true, false, 25.0, 0.3);
            case SANITATION -> new WeatherProfile(true, true, true, 30.0, 0.4);
            case OPERATIONS -> new WeatherProfile(true, false, true, 35.0, 0.6);
            case MAINTENANCE, REPAIR -> new WeatherProfile(true, true, false, 20.0, 0.2);
            case INSPECTION, UNKNOWN -> INDOOR;
        };
    }

    public static WeatherProfile lexicalOutdoor() {
        return new WeatherProfile(true, true, true, 25.0, 0.4);
    }
}
