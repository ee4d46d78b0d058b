package com.workplan.planner.api;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;
import com.workplan.core.model.Coordinate;
import com.workplan.core.model.RouteSequence;
import com.workplan.core.model.RoutineInstance;
import com.workplan.core.model.Task;
import com.workplan.core.model.WeatherSnapshot;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record PlanInputs(
        List<RoutineInstance> routineInstances,
        Map<LocalDate, List<Task>> tasksByDate,
        Map<DayOfWeek, List<RouteSequence>> routesByWeekday,
        WeatherSnapshot weather,
        Coordinate livePosition,
        List<BuildingSummary> assignedBuildings,
        CheckIn explicitCheckIn
) {
    public PlanInputs {
        routineInstances = routineInstances == null ? List.of() : List.copyOf(routineInstances);
        tasksByDate = tasksByDate == null ? Map.of() : Map.copyOf(tasksByDate);
        routesByWeekday = routesByWeekday == null ? Map.of() : Map.copyOf(routesByWeekday);
        assignedBuildings = assignedBuildings == null ? List.of() : List.copyOf(assignedBuildings);
    }

    public static PlanInputs empty() {
        return new PlanInputs(List.of(), Map.of(), Map.of(), null, null, List.of(), null);
    }

    public List<Task> tasksOn(LocalDate date) {
        return tasksByDate.getOrDefault(date, List.of());
    }

    public List<RouteSequence> routesOn(DayOfWeek weekday) {
        return routesByWeekday.getOrDefault(weekday, List.of());
    }
}
