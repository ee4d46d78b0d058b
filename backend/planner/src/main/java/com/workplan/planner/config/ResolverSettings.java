package com.workplan.planner.config;

import java.time.Duration;

public record ResolverSettings(
        Duration upcomingWindow,
        double proximityRadiusMeters,
        Duration checkInMaxAge,
        Duration routeMatchWindow
) {
    public static final Duration DEFAULT_UPCOMING_WINDOW = Duration.ofMinutes(60);
    public static final double DEFAULT_PROXIMITY_RADIUS_METERS = 500.0;
    public static final Duration DEFAULT_CHECK_IN_MAX_AGE = Duration.ofHours(12);
    public static final Duration DEFAULT_ROUTE_MATCH_WINDOW = Duration.ofHours(2);

    public ResolverSettings {
        upcomingWindow = upcomingWindow == null ? DEFAULT_UPCOMING_WINDOW : upcomingWindow;
        proximityRadiusMeters = proximityRadiusMeters <= 0 ? DEFAULT_PROXIMITY_RADIUS_METERS : proximityRadiusMeters;
        checkInMaxAge = checkInMaxAge == null ? DEFAULT_CHECK_IN_MAX_AGE : checkInMaxAge;
        routeMatchWindow = routeMatchWindow == null ? DEFAULT_ROUTE_MATCH_WINDOW : routeMatchWindow;
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(null, 0, null, null);
    }
}
