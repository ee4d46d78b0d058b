package com.workplan.planner.weather;

public enum WeatherChip {
    GOOD_WINDOW("Good Window"),
    WET("Wet Pavement"),
    HEAVY_RAIN("Heavy Rain"),
    WINDY("High Wind"),
    HOT("Heat Alert"),
    COLD("Cold Alert");

    private final String label;

    WeatherChip(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
