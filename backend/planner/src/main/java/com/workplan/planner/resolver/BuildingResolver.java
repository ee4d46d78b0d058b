package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingStatus;
import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.ScheduleEntry;
import com.workplan.planner.config.ResolverSettings;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public final class BuildingResolver {
    private static final Logger LOGGER = Logger.getLogger(BuildingResolver.class.getName());

    private final List<BuildingResolutionStrategy> strategies;

    public BuildingResolver() {
        this(ResolverSettings.defaults());
    }

    public BuildingResolver(ResolverSettings settings) {
        this(defaultChain(settings));
    }

    public BuildingResolver(List<? extends BuildingResolutionStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies is required");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one resolution strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static List<BuildingResolutionStrategy> defaultChain(ResolverSettings settings) {
        return List.of(
                new ExplicitCheckInStrategy(settings.checkInMaxAge()),
                new ActiveWindowStrategy(),
                new UpcomingWindowStrategy(settings.upcomingWindow()),
                new GpsProximityStrategy(settings.proximityRadiusMeters()),
                new AssignedFallbackStrategy()
        );
    }

    public List<String> strategyIds() {
        return strategies.stream().map(BuildingResolutionStrategy::id).toList();
    }

    public Optional<BuildingSummary> resolveCurrentBuilding(WorkerState state) {
        return resolve(state).map(BuildingResolution::building);
    }

    public Optional<BuildingResolution> resolve(WorkerState state) {
        Objects.requireNonNull(state, "state is required");
        for (BuildingResolutionStrategy strategy : strategies) {
            Optional<BuildingSummary> candidate = strategy.resolve(state);
            if (candidate.isPresent()) {
                BuildingSummary current = candidate.get().withStatus(BuildingStatus.CURRENT);
                LOGGER.fine(() -> "Worker " + state.workerId() + " resolved to building " + current.id()
                        + " via " + strategy.id());
                return Optional.of(new BuildingResolution(current, strategy.id()));
            }
        }
        LOGGER.fine(() -> "No building information for worker " + state.workerId());
        return Optional.empty();
    }

    public List<BuildingSummary> statusView(WorkerState state, BuildingResolution resolution) {
        String currentId = resolution == null ? null : resolution.building().id();
        Set<String> scheduledIds = new LinkedHashSet<>();
        for (ScheduleEntry entry : state.todaySchedule()) {
            if (entry.isAttributed()) {
                scheduledIds.add(entry.buildingId());
            }
        }

        Map<String, BuildingSummary> view = new LinkedHashMap<>();
        if (resolution != null) {
            view.put(currentId, resolution.building());
        }
        for (BuildingSummary building : state.assignedBuildings()) {
            if (view.containsKey(building.id())) {
                continue;
            }
            BuildingStatus status;
            if (building.status() == BuildingStatus.UNAVAILABLE) {
                status = BuildingStatus.UNAVAILABLE;
            } else if (scheduledIds.contains(building.id())) {
                status = BuildingStatus.ASSIGNED;
            } else {
                status = BuildingStatus.AVAILABLE;
            }
            view.put(building.id(), building.withStatus(status));
        }
        for (String scheduledId : scheduledIds) {
            view.putIfAbsent(scheduledId, BuildingSummary.placeholder(scheduledId).withStatus(BuildingStatus.COVERAGE));
        }
        return List.copyOf(view.values());
    }
}
