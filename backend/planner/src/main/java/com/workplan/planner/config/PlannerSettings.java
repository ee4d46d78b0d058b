package com.workplan.planner.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

public record PlannerSettings(
        ZoneId zone,
        LocalTime defaultStartTime,
        Duration defaultDuration,
        ResolverSettings resolver,
        WeatherSettings weather
) {
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/New_York");
    public static final LocalTime DEFAULT_START_TIME = LocalTime.of(9, 0);
    public static final Duration DEFAULT_DURATION = Duration.ofMinutes(60);

    public PlannerSettings {
        zone = zone == null ? DEFAULT_ZONE : zone;
        defaultStartTime = defaultStartTime == null ? DEFAULT_START_TIME : defaultStartTime;
        defaultDuration = defaultDuration == null || defaultDuration.isNegative() ? DEFAULT_DURATION : defaultDuration;
        resolver = resolver == null ? ResolverSettings.defaults() : resolver;
        weather = weather == null ? WeatherSettings.defaults() : weather;
    }

    public static PlannerSettings defaults() {
        return new PlannerSettings(null, null, null, null, null);
    }

    public static PlannerSettings forZone(ZoneId zone) {
        return new PlannerSettings(zone, null, null, null, null);
    }
}
