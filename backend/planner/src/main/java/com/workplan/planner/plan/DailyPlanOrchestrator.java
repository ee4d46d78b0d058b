package com.workplan.planner.plan;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;
import com.workplan.core.model.DaySchedule;
import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.RoutineInstance;
import com.workplan.core.model.ScheduleEntry;
import com.workplan.core.model.Task;
import com.workplan.core.model.WeeklyPlan;
import com.workplan.planner.api.PlanInputs;
import com.workplan.planner.calendar.CalendarTaskInjector;
import com.workplan.planner.calendar.CollectionRule;
import com.workplan.planner.config.PlannerSettings;
import com.workplan.planner.policy.TaskPolicy;
import com.workplan.planner.resolver.BuildingResolution;
import com.workplan.planner.resolver.BuildingResolver;
import com.workplan.planner.resolver.WorkerState;
import com.workplan.planner.schedule.CollectedEntries;
import com.workplan.planner.schedule.MergeResult;
import com.workplan.planner.schedule.ScheduleMerger;
import com.workplan.planner.weather.WeatherOrdering;
import com.workplan.planner.weather.WeatherSuggestion;
import com.workplan.planner.weather.WeatherSuggestionEngine;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class DailyPlanOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(DailyPlanOrchestrator.class.getName());
    static final int PLAN_DAYS = 7;

    private final PlannerSettings settings;
    private final List<CollectionRule> collectionRules;
    private final TaskPolicy taskPolicy;
    private final Clock clock;
    private final ScheduleMerger merger;
    private final CalendarTaskInjector injector;
    private final BuildingResolver resolver;
    private final WeatherSuggestionEngine weatherEngine;

    public DailyPlanOrchestrator(PlannerSettings settings, Clock clock) {
        this(settings, List.of(), TaskPolicy.none(), clock);
    }

    public DailyPlanOrchestrator(
            PlannerSettings settings,
            List<CollectionRule> collectionRules,
            TaskPolicy taskPolicy,
            Clock clock
    ) {
        this.settings = settings == null ? PlannerSettings.defaults() : settings;
        this.collectionRules = collectionRules == null ? List.of() : List.copyOf(collectionRules);
        this.taskPolicy = taskPolicy == null ? TaskPolicy.none() : taskPolicy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.merger = new ScheduleMerger(this.settings);
        this.injector = new CalendarTaskInjector(this.settings.zone());
        this.resolver = new BuildingResolver(this.settings.resolver());
        this.weatherEngine = new WeatherSuggestionEngine(this.settings.weather(), this.settings.zone());
    }

    public PlannerSettings settings() {
        return settings;
    }

    public DailyPlan buildPlan(String workerId, LocalDate date, PlanInputs inputs) {
        if (workerId == null || workerId.isBlank()) {
            throw new InvalidPlanInputException("workerId is required");
        }
        if (date == null) {
            throw new InvalidPlanInputException("date is required");
        }
        if (inputs == null) {
            throw new InvalidPlanInputException("inputs are required");
        }

        Instant now = clock.instant();
        String fallbackBuildingId = fallbackBuildingId(inputs, now);
        Map<LocalDate, List<RoutineInstance>> routinesByDate = bucketRoutines(inputs.routineInstances());

        List<DaySchedule> days = new ArrayList<>(PLAN_DAYS);
        List<PlanIssue> issues = new ArrayList<>();
        List<ScheduleEntry> injectedToday = List.of();
        for (int offset = 0; offset < PLAN_DAYS; offset++) {
            LocalDate day = date.plusDays(offset);
            CollectedEntries collected = merger.collectEntries(
                    day,
                    routinesByDate.getOrDefault(day, List.of()),
                    inputs.tasksOn(day),
                    inputs.routesOn(day.getDayOfWeek()),
                    fallbackBuildingId
            );
            List<ScheduleEntry> injected = injector.inject(day, workerId, collectionRules, collected.entries());
            List<ScheduleEntry> all = new ArrayList<>(collected.entries());
            all.addAll(injected);
            MergeResult result = merger.finalizeDay(day, all, collected.issues());
            days.add(result.day());
            issues.addAll(result.issues());
            if (offset == 0) {
                injectedToday = injected;
            }
        }
        WeeklyPlan weeklyPlan = new WeeklyPlan(days);
        DaySchedule today = days.get(0);

        WorkerState state = new WorkerState(
                workerId,
                now,
                inputs.explicitCheckIn(),
                today.items(),
                inputs.livePosition(),
                inputs.assignedBuildings()
        );
        Optional<BuildingResolution> resolution = resolver.resolve(state);
        List<BuildingSummary> buildings = resolver.statusView(state, resolution.orElse(null));

        List<Task> candidates = new ArrayList<>();
        for (ScheduleEntry entry : today.items()) {
            if (entry.endTime().isAfter(now)) {
                candidates.add(entry.toTask());
            }
        }
        WeatherOrdering ordering = weatherEngine.planImmediate(taskPolicy.applyAll(workerId, candidates), inputs.weather());

        List<WeatherSuggestion> suggestions = new ArrayList<>();
        if (resolution.isPresent() && inputs.weather() != null) {
            BuildingSummary current = resolution.get().building();
            ScheduleEntry collectionEntry = injectedToday.stream()
                    .filter(entry -> entry.buildingId().equals(current.id()))
                    .min(ScheduleMerger.ENTRY_ORDER)
                    .orElse(null);
            List<String> upcomingTitles = ordering.ordered().stream().map(scored -> scored.task().title()).toList();
            suggestions.addAll(weatherEngine.suggestions(current, inputs.weather(), date, collectionEntry, upcomingTitles));
        }
        suggestions.addAll(ordering.substitutes());

        DailyPlan plan = new DailyPlan(
                workerId,
                date,
                now,
                weeklyPlan,
                resolution.map(BuildingResolution::building).orElse(null),
                resolution.map(BuildingResolution::strategyId).orElse(null),
                buildings,
                ordering.ordered(),
                ordering.deferred(),
                suggestions,
                ordering.deferralActive(),
                issues
        );
        LOGGER.fine(() -> "Built plan for " + workerId + " on " + date + ": "
                + plan.orderedUpcoming().size() + " upcoming, "
                + plan.deferredOutdoor().size() + " deferred, "
                + plan.issues().size() + " issue(s)");
        return plan;
    }

    private String fallbackBuildingId(PlanInputs inputs, Instant now) {
        CheckIn checkIn = inputs.explicitCheckIn();
        if (checkIn != null && checkIn.isActiveAt(now, settings.resolver().checkInMaxAge())) {
            return checkIn.building().id();
        }
        return inputs.assignedBuildings().isEmpty() ? null : inputs.assignedBuildings().get(0).id();
    }

    private Map<LocalDate, List<RoutineInstance>> bucketRoutines(List<RoutineInstance> routines) {
        Map<LocalDate, List<RoutineInstance>> byDate = new HashMap<>();
        routines.stream()
                .sorted(Comparator.comparing(RoutineInstance::startTime).thenComparing(RoutineInstance::id))
                .forEach(routine -> byDate
                        .computeIfAbsent(routine.startTime().atZone(settings.zone()).toLocalDate(), ignored -> new ArrayList<>())
                        .add(routine));
        return byDate;
    }
}
