package com.workplan.planner.resolver;

import com.workplan.core.model.BuildingStatus;
import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.CheckIn;
import com.workplan.core.model.Coordinate;
import com.workplan.core.model.EntryOrigin;
import com.workplan.core.model.ScheduleEntry;
import com.workplan.core.model.Urgency;
import com.workplan.planner.config.ResolverSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildingResolverTest {
    private static final Instant NOW = Instant.parse("2024-06-03T10:00:00Z");
    private static final Coordinate ORIGIN = new Coordinate(0.0, 0.0);

    private final BuildingResolver resolver = new BuildingResolver();

    @Test
    void defaultChainRunsInPriorityOrder() {
        assertEquals(
                List.of("explicit-check-in", "active-window", "upcoming-window", "gps-proximity", "assigned-fallback"),
                resolver.strategyIds()
        );
    }

    @Test
    void validCheckInWinsOverScheduleAndPosition() {
        BuildingSummary checkedIn = building("b-check", null);
        WorkerState state = new WorkerState(
                "worker-1",
                NOW,
                new CheckIn(checkedIn, NOW.minus(Duration.ofMinutes(20)), null),
                List.of(entry("e1", "b-active", NOW.minus(Duration.ofMinutes(5)), NOW.plus(Duration.ofMinutes(30)))),
                ORIGIN,
                List.of(building("b-near", ORIGIN), building("b-active", null))
        );

        BuildingResolution resolution = resolver.resolve(state).orElseThrow();

        assertEquals("b-check", resolution.building().id());
        assertEquals(ExplicitCheckInStrategy.ID, resolution.strategyId());
        assertEquals(BuildingStatus.CURRENT, resolution.building().status());
    }

    @Test
    void expiredCheckInFallsThroughToActiveWindow() {
        CheckIn expired = new CheckIn(building("b-check", null), NOW.minus(Duration.ofHours(3)), NOW.minus(Duration.ofHours(1)));
        CheckIn stale = new CheckIn(building("b-check", null), NOW.minus(Duration.ofHours(13)), null);
        List<ScheduleEntry> schedule = List.of(entry("e1", "b-active", NOW.minus(Duration.ofMinutes(5)), NOW.plus(Duration.ofMinutes(30))));

        for (CheckIn checkIn : List.of(expired, stale)) {
            WorkerState state = new WorkerState("worker-1", NOW, checkIn, schedule, null, List.of());
            BuildingResolution resolution = resolver.resolve(state).orElseThrow();
            assertEquals("b-active", resolution.building().id());
            assertEquals(ActiveWindowStrategy.ID, resolution.strategyId());
        }
    }

    @Test
    void activeWindowPrefersEarliestStartThenTitleAndSkipsUnattributedEntries() {
        List<ScheduleEntry> schedule = List.of(
                entry("e0", "", NOW.minus(Duration.ofMinutes(50)), NOW.plus(Duration.ofMinutes(10))),
                entry("e2", "b-late", NOW.minus(Duration.ofMinutes(10)), NOW.plus(Duration.ofMinutes(10))),
                entry("e1", "b-early", NOW.minus(Duration.ofMinutes(30)), NOW.plus(Duration.ofMinutes(10)))
        );
        WorkerState state = new WorkerState("worker-1", NOW, null, schedule, null,
                List.of(building("b-late", null), building("b-early", null)));

        assertEquals("b-early", resolver.resolveCurrentBuilding(state).orElseThrow().id());
    }

    @Test
    void upcomingWindowLooksAheadOneHourOnly() {
        ScheduleEntry inFifty = entry("soon", "b-soon", NOW.plus(Duration.ofMinutes(50)), NOW.plus(Duration.ofMinutes(80)));
        ScheduleEntry inNinety = entry("later", "b-later", NOW.plus(Duration.ofMinutes(90)), NOW.plus(Duration.ofMinutes(120)));

        WorkerState withSoon = new WorkerState("worker-1", NOW, null, List.of(inNinety, inFifty), null, List.of());
        BuildingResolution resolution = resolver.resolve(withSoon).orElseThrow();
        assertEquals("b-soon", resolution.building().id());
        assertEquals(UpcomingWindowStrategy.ID, resolution.strategyId());

        WorkerState onlyLater = new WorkerState("worker-1", NOW, null, List.of(inNinety), null, List.of());
        assertTrue(resolver.resolve(onlyLater).isEmpty());
    }

    @Test
    void scheduledBuildingOutsideAssignedListResolvesToPlaceholder() {
        WorkerState state = new WorkerState("worker-1", NOW, null,
                List.of(entry("e1", "b-cover", NOW.minusSeconds(60), NOW.plusSeconds(600))), null, List.of());

        BuildingSummary current = resolver.resolveCurrentBuilding(state).orElseThrow();

        assertEquals("b-cover", current.id());
        assertEquals("b-cover", current.name());
    }

    @Test
    void gpsPicksNearestBuildingInsideRadius() {
        BuildingSummary at400 = building("b-400", metersNorth(400.0));
        BuildingSummary at600 = building("b-600", metersNorth(600.0));
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), ORIGIN, List.of(at600, at400));

        BuildingResolution resolution = resolver.resolve(state).orElseThrow();

        assertEquals("b-400", resolution.building().id());
        assertEquals(GpsProximityStrategy.ID, resolution.strategyId());
    }

    @Test
    void gpsOutsideRadiusFallsBackToFirstAssigned() {
        BuildingSummary first = building("b-first", metersNorth(900.0));
        BuildingSummary second = building("b-second", metersNorth(600.0));
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), ORIGIN, List.of(first, second));

        BuildingResolution resolution = resolver.resolve(state).orElseThrow();

        assertEquals("b-first", resolution.building().id());
        assertEquals(AssignedFallbackStrategy.ID, resolution.strategyId());
    }

    @Test
    void gpsTieBreaksOnLowestBuildingId() {
        BuildingSummary north = building("b-z", metersNorth(300.0));
        BuildingSummary south = building("b-a", new Coordinate(-metersNorth(300.0).latitude(), 0.0));
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), ORIGIN, List.of(north, south));

        assertEquals("b-a", resolver.resolveCurrentBuilding(state).orElseThrow().id());
    }

    @Test
    void resolverIsTotalWhenAssignedBuildingsExist() {
        List<BuildingSummary> assigned = List.of(building("b-1", null), building("b-2", null));
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), null, assigned);

        assertEquals("b-1", resolver.resolveCurrentBuilding(state).orElseThrow().id());
        assertTrue(resolver.resolveCurrentBuilding(new WorkerState("worker-1", NOW, null, null, null, null)).isEmpty());
    }

    @Test
    void customRadiusComesFromSettings() {
        BuildingResolver wide = new BuildingResolver(new ResolverSettings(null, 1_000.0, null, null));
        BuildingSummary at600 = building("b-600", metersNorth(600.0));
        BuildingSummary other = building("b-other", null);
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), ORIGIN, List.of(other, at600));

        assertEquals("b-600", wide.resolveCurrentBuilding(state).orElseThrow().id());
        assertEquals("b-other", resolver.resolveCurrentBuilding(state).orElseThrow().id());
    }

    @Test
    void customChainIsTriedInGivenOrder() {
        BuildingResolutionStrategy never = new BuildingResolutionStrategy() {
            @Override
            public String id() {
                return "never";
            }

            @Override
            public Optional<BuildingSummary> resolve(WorkerState state) {
                return Optional.empty();
            }
        };
        BuildingResolver chain = new BuildingResolver(List.of(never, new AssignedFallbackStrategy()));
        WorkerState state = new WorkerState("worker-1", NOW, null, List.of(), null, List.of(building("b-1", null)));

        assertEquals("assigned-fallback", chain.resolve(state).orElseThrow().strategyId());
    }

    @Test
    void statusViewMarksExactlyOneCurrentBuilding() {
        List<BuildingSummary> assigned = List.of(
                building("b-1", null),
                building("b-2", null),
                building("b-3", null),
                new BuildingSummary("b-4", "Closed", "", null, BuildingStatus.UNAVAILABLE)
        );
        List<ScheduleEntry> schedule = List.of(
                entry("e1", "b-1", NOW.minusSeconds(60), NOW.plusSeconds(600)),
                entry("e2", "b-2", NOW.plus(Duration.ofHours(3)), NOW.plus(Duration.ofHours(4))),
                entry("e3", "b-9", NOW.plus(Duration.ofHours(5)), NOW.plus(Duration.ofHours(6)))
        );
        WorkerState state = new WorkerState("worker-1", NOW, null, schedule, null, assigned);

        List<BuildingSummary> view = resolver.statusView(state, resolver.resolve(state).orElse(null));
        Map<String, BuildingStatus> statuses = view.stream()
                .collect(Collectors.toMap(BuildingSummary::id, BuildingSummary::status));

        assertEquals(BuildingStatus.CURRENT, statuses.get("b-1"));
        assertEquals(BuildingStatus.ASSIGNED, statuses.get("b-2"));
        assertEquals(BuildingStatus.AVAILABLE, statuses.get("b-3"));
        assertEquals(BuildingStatus.UNAVAILABLE, statuses.get("b-4"));
        assertEquals(BuildingStatus.COVERAGE, statuses.get("b-9"));
        assertEquals(1, view.stream().filter(b -> b.status() == BuildingStatus.CURRENT).count());
        assertEquals(5, view.size());
    }

    private static Coordinate metersNorth(double meters) {
        return new Coordinate(Math.toDegrees(meters / Coordinate.EARTH_RADIUS_METERS), 0.0);
    }

    private static BuildingSummary building(String id, Coordinate coordinate) {
        return new BuildingSummary(id, "Building " + id, "", coordinate, BuildingStatus.ASSIGNED);
    }

    private static ScheduleEntry entry(String id, String buildingId, Instant start, Instant end) {
        return new ScheduleEntry(id, buildingId, null, "Task " + id, "Cleaning", start, end, 1, Urgency.NORMAL, EntryOrigin.ROUTINE);
    }
}
