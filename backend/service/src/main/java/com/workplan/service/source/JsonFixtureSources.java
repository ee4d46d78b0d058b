package com.workplan.service.source;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;
import com.workplan.core.model.Coordinate;
import com.workplan.core.model.RouteSequence;
import com.workplan.core.model.RoutineInstance;
import com.workplan.core.model.Task;
import com.workplan.core.model.WeatherSnapshot;
import com.workplan.core.util.JsonUtils;
import com.workplan.planner.api.AssignedBuildingSource;
import com.workplan.planner.api.CheckInSource;
import com.workplan.planner.api.PositionSource;
import com.workplan.planner.api.RoutePlanSource;
import com.workplan.planner.api.RoutineScheduleSource;
import com.workplan.planner.api.TaskSource;
import com.workplan.planner.api.WeatherSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class JsonFixtureSources implements RoutineScheduleSource, TaskSource, RoutePlanSource, WeatherSource,
        PositionSource, AssignedBuildingSource, CheckInSource {
    private final Map<String, WorkerFixture> workers;
    private final WeatherSnapshot weather;
    private final Coordinate position;
    private final ZoneId zone;

    public JsonFixtureSources(Path jsonFile, ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
        try (InputStream in = Files.newInputStream(jsonFile)) {
            Fixture fixture = JsonUtils.objectMapper().readValue(in, Fixture.class);
            this.workers = fixture.workers() == null ? Map.of() : Map.copyOf(fixture.workers());
            this.weather = fixture.weather();
            this.position = fixture.position();
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed reading plan fixture: " + jsonFile, e);
        }
    }

    public boolean hasWorker(String workerId) {
        return workers.containsKey(workerId);
    }

    @Override
    public List<RoutineInstance> getRoutineInstances(String workerId, LocalDate from, LocalDate toInclusive) {
        return worker(workerId).routines().stream()
                .filter(routine -> {
                    LocalDate day = routine.startTime().atZone(zone).toLocalDate();
                    return !day.isBefore(from) && !day.isAfter(toInclusive);
                })
                .toList();
    }

    @Override
    public List<Task> getTasks(String workerId, LocalDate date) {
        return worker(workerId).tasks().getOrDefault(date, List.of());
    }

    @Override
    public List<RouteSequence> getRouteSequences(String workerId, DayOfWeek weekday) {
        return worker(workerId).routes().getOrDefault(weekday, List.of());
    }

    @Override
    public WeatherSnapshot getForecast() {
        return weather;
    }

    @Override
    public Optional<Coordinate> getCurrentPosition() {
        return Optional.ofNullable(position);
    }

    @Override
    public List<BuildingSummary> getAssignedBuildings(String workerId) {
        return worker(workerId).assignedBuildings();
    }

    @Override
    public Optional<CheckIn> getActiveCheckIn(String workerId) {
        return Optional.ofNullable(worker(workerId).checkIn());
    }

    private WorkerFixture worker(String workerId) {
        return workers.getOrDefault(workerId, WorkerFixture.EMPTY);
    }

    private record Fixture(Map<String, WorkerFixture> workers, WeatherSnapshot weather, Coordinate position) {
    }

    private record WorkerFixture(
            List<RoutineInstance> routines,
            Map<LocalDate, List<Task>> tasks,
            Map<DayOfWeek, List<RouteSequence>> routes,
            List<BuildingSummary> assignedBuildings,
            CheckIn checkIn
    ) {
        static final WorkerFixture EMPTY = new WorkerFixture(null, null, null, null, null);

        WorkerFixture {
            routines = routines == null ? List.of() : List.copyOf(routines);
            tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
            routes = routes == null ? Map.of() : Map.copyOf(routes);
            assignedBuildings = assignedBuildings == null ? List.of() : List.copyOf(assignedBuildings);
        }
    }
}
