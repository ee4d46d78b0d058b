package com.workplan.planner.schedule;

import com.workplan.core.model.DaySchedule;
import com.workplan.core.model.EntryOrigin;
import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.RouteOperation;
import com.workplan.core.model.RouteSequence;
import com.workplan.core.model.RoutineInstance;
import com.workplan.core.model.ScheduleEntry;
import com.workplan.core.model.Task;
import com.workplan.core.model.Urgency;
import com.workplan.planner.config.PlannerSettings;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

public final class ScheduleMerger {
    private static final Logger LOGGER = Logger.getLogger(ScheduleMerger.class.getName());

    public static final Comparator<ScheduleEntry> ENTRY_ORDER = Comparator
            .comparing(ScheduleEntry::startTime)
            .thenComparing(ScheduleEntry::title)
            .thenComparing(ScheduleEntry::buildingId)
            .thenComparing(ScheduleEntry::id);

    private final ZoneId zone;
    private final LocalTime defaultStartTime;
    private final Duration defaultDuration;
    private final Duration routeMatchWindow;

    public ScheduleMerger() {
        this(PlannerSettings.defaults());
    }

    public ScheduleMerger(PlannerSettings settings) {
        this.zone = settings.zone();
        this.defaultStartTime = settings.defaultStartTime();
        this.defaultDuration = settings.defaultDuration();
        this.routeMatchWindow = settings.resolver().routeMatchWindow();
    }

    public MergeResult mergeDay(
            LocalDate date,
            List<RoutineInstance> routineInstances,
            List<Task> adHocTasks,
            List<RouteSequence> routeSequences,
            String fallbackBuildingId
    ) {
        return mergeDay(date, routineInstances, adHocTasks, routeSequences, fallbackBuildingId, List.of());
    }

    public MergeResult mergeDay(
            LocalDate date,
            List<RoutineInstance> routineInstances,
            List<Task> adHocTasks,
            List<RouteSequence> routeSequences,
            String fallbackBuildingId,
            List<ScheduleEntry> injectedEntries
    ) {
        CollectedEntries collected = collectEntries(date, routineInstances, adHocTasks, routeSequences, fallbackBuildingId);
        List<ScheduleEntry> all = new ArrayList<>(collected.entries());
        if (injectedEntries != null) {
            all.addAll(injectedEntries);
        }
        return finalizeDay(date, all, collected.issues());
    }

    public CollectedEntries collectEntries(
            LocalDate date,
            List<RoutineInstance> routineInstances,
            List<Task> adHocTasks,
            List<RouteSequence> routeSequences,
            String fallbackBuildingId
    ) {
        Objects.requireNonNull(date, "date is required");
        List<RoutineInstance> routines = routineInstances == null ? List.of() : routineInstances;
        List<Task> tasks = adHocTasks == null ? List.of() : adHocTasks;
        List<RouteSequence> routes = routeSequences == null ? List.of() : routeSequences;

        List<ScheduleEntry> entries = new ArrayList<>();
        List<PlanIssue> issues = new ArrayList<>();
        if (routines.isEmpty() && tasks.isEmpty() && routes.isEmpty()) {
            issues.add(PlanIssue.missingData(date.toString(), "No routine, task or route data for " + date));
        }

        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();

        boolean routineOnDay = false;
        for (RoutineInstance routine : routines) {
            if (!withinDay(routine.startTime(), dayStart, dayEnd)) {
                continue;
            }
            routineOnDay = true;
            Instant end = routine.endTime() == null ? routine.startTime().plus(defaultDuration) : routine.endTime();
            end = clampEnd(routine.id(), routine.startTime(), end, issues);
            if (routine.buildingId().isBlank()) {
                issues.add(PlanIssue.ambiguousBuilding(routine.id(), "Routine '" + routine.title() + "' has no building"));
            }
            entries.add(new ScheduleEntry(
                    routine.id(),
                    routine.buildingId(),
                    null,
                    routine.title(),
                    routine.category(),
                    routine.startTime(),
                    end,
                    1,
                    Urgency.NORMAL,
                    EntryOrigin.ROUTINE
            ));
        }

        if (!routineOnDay) {
            for (RouteSequence route : routes) {
                entries.add(routeEntry(date, route, issues));
            }
        }

        for (Task task : tasks) {
            if (task.completed()) {
                continue;
            }
            if (task.dueTime() != null && !withinDay(task.dueTime(), dayStart, dayEnd)) {
                continue;
            }
            entries.add(taskEntry(date, task, routes, fallbackBuildingId, issues));
        }

        if (!issues.isEmpty()) {
            LOGGER.fine(() -> "Collected " + entries.size() + " entries for " + date + " with " + issues.size() + " issue(s)");
        }
        return new CollectedEntries(entries, issues);
    }

    public MergeResult finalizeDay(LocalDate date, List<ScheduleEntry> entries, List<PlanIssue> issues) {
        Objects.requireNonNull(date, "date is required");
        List<ScheduleEntry> merged = deduplicate(entries == null ? List.of() : entries);
        return new MergeResult(DaySchedule.of(date, merged), issues);
    }

    public static List<ScheduleEntry> deduplicate(List<ScheduleEntry> entries) {
        Map<ScheduleEntry.DedupKey, List<ScheduleEntry>> groups = new LinkedHashMap<>();
        for (ScheduleEntry entry : entries) {
            groups.computeIfAbsent(entry.dedupKey(), ignored -> new ArrayList<>()).add(entry);
        }
        List<ScheduleEntry> merged = new ArrayList<>(groups.size());
        for (List<ScheduleEntry> group : groups.values()) {
            merged.add(collapse(group));
        }
        merged.sort(ENTRY_ORDER);
        return List.copyOf(merged);
    }

    private static ScheduleEntry collapse(List<ScheduleEntry> group) {
        if (group.size() == 1) {
            return group.get(0);
        }
        // smallest id represents the group whatever the input order
        ScheduleEntry representative = group.stream()
                .min(Comparator.comparing(ScheduleEntry::id))
                .orElseThrow();
        Instant end = representative.endTime();
        Urgency urgency = representative.urgency();
        int count = 0;
        boolean requiresPhoto = false;
        for (ScheduleEntry entry : group) {
            requiresPhoto |= entry.requiresPhoto();
            if (entry.endTime().isAfter(end)) {
                end = entry.endTime();
            }
            urgency = Urgency.max(urgency, entry.urgency());
            count += entry.taskCount();
        }
        return representative.withEnd(end, count, urgency).withRequiresPhoto(requiresPhoto);
    }

    private ScheduleEntry taskEntry(
            LocalDate date,
            Task task,
            List<RouteSequence> routes,
            String fallbackBuildingId,
            List<PlanIssue> issues
    ) {
        Instant start = task.dueTime() != null ? task.dueTime() : date.atTime(defaultStartTime).atZone(zone).toInstant();
        Duration duration = task.estimatedDuration() != null ? task.estimatedDuration() : defaultDuration;
        Instant end = clampEnd(task.id(), start, start.plus(duration), issues);

        String buildingId;
        if (task.hasBuilding()) {
            buildingId = task.buildingId();
        } else {
            buildingId = routeBuildingFor(date, start, routes)
                    .orElseGet(() -> fallbackBuildingId == null ? "" : fallbackBuildingId);
            if (buildingId.isBlank()) {
                issues.add(PlanIssue.ambiguousBuilding(task.id(), "Task '" + task.title() + "' has no resolvable building"));
            }
        }

        return new ScheduleEntry(
                task.id(),
                buildingId,
                null,
                task.title(),
                task.category(),
                start,
                end,
                1,
                task.urgency(),
                EntryOrigin.AD_HOC,
                task.requiresPhoto()
        );
    }

    private ScheduleEntry routeEntry(LocalDate date, RouteSequence route, List<PlanIssue> issues) {
        Instant start = route.arrivalOn(date, zone);
        Duration duration = route.estimatedDuration().isZero() ? defaultDuration : route.estimatedDuration();
        List<RouteOperation> operations = route.operations();
        String category = operations.isEmpty() || operations.get(0).category() == null ? "" : operations.get(0).category();
        String id = "route:" + date + ":" + route.buildingId() + ":" + route.arrivalTime();
        return new ScheduleEntry(
                id,
                route.buildingId(),
                null,
                "Route: " + route.buildingName(),
                category,
                start,
                clampEnd(id, start, start.plus(duration), issues),
                Math.max(1, operations.size()),
                Urgency.NORMAL,
                EntryOrigin.ROUTE,
                operations.stream().anyMatch(RouteOperation::requiresPhoto)
        );
    }

    private Optional<String> routeBuildingFor(LocalDate date, Instant start, List<RouteSequence> routes) {
        Optional<RouteSequence> active = routes.stream()
                .filter(route -> route.windowContains(date, zone, start))
                .min(Comparator.comparing(RouteSequence::arrivalTime).thenComparing(RouteSequence::buildingId));
        if (active.isPresent()) {
            return active.map(RouteSequence::buildingId);
        }
        return routes.stream()
                .filter(route -> distance(route, date, start).compareTo(routeMatchWindow) <= 0)
                .min(Comparator.<RouteSequence, Duration>comparing(route -> distance(route, date, start))
                        .thenComparing(RouteSequence::buildingId))
                .map(RouteSequence::buildingId);
    }

    private Duration distance(RouteSequence route, LocalDate date, Instant start) {
        return Duration.between(route.arrivalOn(date, zone), start).abs();
    }

    private static Instant clampEnd(String subjectId, Instant start, Instant end, List<PlanIssue> issues) {
        if (end.isBefore(start)) {
            issues.add(PlanIssue.invalidTimeWindow(subjectId, "End time before start time; clamped to start"));
            return start;
        }
        return end;
    }

    private static boolean withinDay(Instant instant, Instant dayStart, Instant dayEnd) {
        return !instant.isBefore(dayStart) && instant.isBefore(dayEnd);
    }
}
