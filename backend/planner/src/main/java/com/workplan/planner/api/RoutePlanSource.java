package com.workplan.planner.api;

import com.workplan.core.model.RouteSequence;

import java.time.DayOfWeek;
import java.util.List;

public interface RoutePlanSource {
    List<RouteSequence> getRouteSequences(String workerId, DayOfWeek weekday);
}
