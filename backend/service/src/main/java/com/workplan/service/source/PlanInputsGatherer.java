package com.workplan.service.source;

import com.workplan.core.model.RouteSequence;
import com.workplan.core.model.Task;
import com.workplan.core.model.WeatherSnapshot;
import com.workplan.planner.api.AssignedBuildingSource;
import com.workplan.planner.api.CheckInSource;
import com.workplan.planner.api.PlanInputs;
import com.workplan.planner.api.PositionSource;
import com.workplan.planner.api.RoutePlanSource;
import com.workplan.planner.api.RoutineScheduleSource;
import com.workplan.planner.api.TaskSource;
import com.workplan.planner.api.WeatherSource;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

public class PlanInputsGatherer {
    private static final Logger LOGGER = Logger.getLogger(PlanInputsGatherer.class.getName());
    private static final int DAYS = 7;

    private final RoutineScheduleSource routines;
    private final TaskSource tasks;
    private final RoutePlanSource routes;
    private final WeatherSource weather;
    private final PositionSource position;
    private final AssignedBuildingSource assigned;
    private final CheckInSource checkIns;

    public PlanInputsGatherer(
            RoutineScheduleSource routines,
            TaskSource tasks,
            RoutePlanSource routes,
            WeatherSource weather,
            PositionSource position,
            AssignedBuildingSource assigned,
            CheckInSource checkIns
    ) {
        this.routines = Objects.requireNonNull(routines, "routines is required");
        this.tasks = Objects.requireNonNull(tasks, "tasks is required");
        this.routes = Objects.requireNonNull(routes, "routes is required");
        this.weather = Objects.requireNonNull(weather, "weather is required");
        this.position = Objects.requireNonNull(position, "position is required");
        this.assigned = Objects.requireNonNull(assigned, "assigned is required");
        this.checkIns = Objects.requireNonNull(checkIns, "checkIns is required");
    }

    public static PlanInputsGatherer of(JsonFixtureSources sources) {
        return new PlanInputsGatherer(sources, sources, sources, sources, sources, sources, sources);
    }

    public PlanInputs gather(String workerId, LocalDate date) {
        Map<LocalDate, List<Task>> tasksByDate = new HashMap<>();
        Map<DayOfWeek, List<RouteSequence>> routesByWeekday = new EnumMap<>(DayOfWeek.class);
        for (int offset = 0; offset < DAYS; offset++) {
            LocalDate day = date.plusDays(offset);
            tasksByDate.put(day, nullToEmpty(tasks.getTasks(workerId, day)));
            routesByWeekday.put(day.getDayOfWeek(), nullToEmpty(routes.getRouteSequences(workerId, day.getDayOfWeek())));
        }
        return new PlanInputs(
                nullToEmpty(routines.getRoutineInstances(workerId, date, date.plusDays(DAYS - 1))),
                tasksByDate,
                routesByWeekday,
                forecast(),
                position.getCurrentPosition().orElse(null),
                nullToEmpty(assigned.getAssignedBuildings(workerId)),
                checkIns.getActiveCheckIn(workerId).orElse(null)
        );
    }

    private WeatherSnapshot forecast() {
        try {
            return weather.getForecast();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Weather source failed; planning without weather", e);
            return null;
        }
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
