package com.workplan.planner.config;

import java.util.List;
import java.util.Locale;

public record WeatherSettings(
        int lookaheadHours,
        double precipThreshold,
        Double coldThresholdF,
        double windThresholdMph,
        List<String> outdoorVocabulary
) {
    public static final int DEFAULT_LOOKAHEAD_HOURS = 2;
    public static final double DEFAULT_PRECIP_THRESHOLD = 0.4;
    public static final double DEFAULT_COLD_THRESHOLD_F = 45.0;
    public static final double DEFAULT_WIND_THRESHOLD_MPH = 25.0;
    public static final List<String> DEFAULT_OUTDOOR_VOCABULARY = List.of(
            "hose", "hosing", "sidewalk", "exterior", "curb", "courtyard", "roof",
            "gutter", "treepit", "facade", "awning", "set out", "set-out"
    );

    public WeatherSettings {
        lookaheadHours = lookaheadHours <= 0 ? DEFAULT_LOOKAHEAD_HOURS : lookaheadHours;
        precipThreshold = precipThreshold <= 0 ? DEFAULT_PRECIP_THRESHOLD : precipThreshold;
        coldThresholdF = coldThresholdF == null ? DEFAULT_COLD_THRESHOLD_F : coldThresholdF;
        windThresholdMph = windThresholdMph <= 0 ? DEFAULT_WIND_THRESHOLD_MPH : windThresholdMph;
        outdoorVocabulary = outdoorVocabulary == null || outdoorVocabulary.isEmpty()
                ? DEFAULT_OUTDOOR_VOCABULARY
                : outdoorVocabulary.stream().map(term -> term.trim().toLowerCase(Locale.ROOT)).toList();
    }

    public static WeatherSettings defaults() {
        return new WeatherSettings(0, 0, null, 0, null);
    }
}
