package com.workplan.core.model;

import com.workplan.core.events.CurrentBuildingChanged;
import com.workplan.core.events.PlanComputed;
import com.workplan.core.events.PlanIssueRaised;
import com.workplan.core.events.PlanRefreshFailed;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsTest {
    private static final Instant NINE = Instant.parse("2024-06-03T09:00:00Z");

    @Test
    void dedupKeyNormalizesTitleAndTruncatesToMinute() {
        ScheduleEntry a = entry("a", "b-1", null, "  Lobby Clean ", NINE.plusSeconds(12));
        ScheduleEntry b = entry("b", "b-1", null, "lobby clean", NINE.plusSeconds(48));
        ScheduleEntry otherBuilding = entry("c", "b-2", null, "lobby clean", NINE);
        ScheduleEntry circuit = entry("d", "b-1", "circuit:rule-1", "lobby clean", NINE);

        assertEquals(a.dedupKey(), b.dedupKey());
        assertNotEquals(a.dedupKey(), otherBuilding.dedupKey());
        assertNotEquals(a.dedupKey(), circuit.dedupKey());
        assertEquals("circuit:rule-1/b-1", circuit.dedupKey().attribution());
    }

    @Test
    void scheduleEntryRejectsInvertedWindowAndEmptyCount() {
        assertThrows(IllegalArgumentException.class, () -> entry("x", "b-1", null, "t", NINE).withEnd(NINE.minusSeconds(60), 1, Urgency.LOW));
        assertThrows(IllegalArgumentException.class, () -> new ScheduleEntry(
                "x", "b-1", null, "t", "", NINE, NINE, 0, Urgency.LOW, EntryOrigin.AD_HOC));
    }

    @Test
    void scheduleEntryConvertsToTaskDueAtStart() {
        ScheduleEntry unattributed = entry("x", "", null, "Mop", NINE);
        Task task = unattributed.toTask();

        assertFalse(unattributed.isAttributed());
        assertEquals(NINE, task.dueTime());
        assertFalse(task.hasBuilding());
        assertEquals(Duration.ofHours(1), task.estimatedDuration());
        assertFalse(task.requiresPhoto());
        assertTrue(unattributed.withRequiresPhoto(true).toTask().requiresPhoto());
    }

    @Test
    void urgencyOrderingAndLabels() {
        assertTrue(Urgency.EMERGENCY.isAtLeast(Urgency.URGENT));
        assertEquals(Urgency.HIGH, Urgency.max(Urgency.LOW, Urgency.HIGH));
        assertEquals(Urgency.CRITICAL, Urgency.fromLabel(" critical "));
        assertEquals(Urgency.NORMAL, Urgency.fromLabel("whenever"));
        assertEquals(TaskCategory.SANITATION, TaskCategory.fromLabel("Sanitation"));
        assertEquals(TaskCategory.UNKNOWN, TaskCategory.fromLabel(null));
    }

    @Test
    void coordinateDistanceAndValidation() {
        Coordinate origin = new Coordinate(40.0, -73.0);
        Coordinate north = new Coordinate(40.0 + Math.toDegrees(400.0 / Coordinate.EARTH_RADIUS_METERS), -73.0);

        assertEquals(400.0, origin.distanceMeters(north), 0.01);
        assertEquals(0.0, origin.distanceMeters(origin), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(91.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(0.0, -181.0));
    }

    @Test
    void checkInExpiresAtDeadlineOrMaxAge() {
        CheckIn checkIn = new CheckIn(BuildingSummary.placeholder("b-1"), NINE, NINE.plus(Duration.ofHours(2)));

        assertTrue(checkIn.isActiveAt(NINE.plusSeconds(60), Duration.ofHours(12)));
        assertFalse(checkIn.isActiveAt(NINE.plus(Duration.ofHours(2)), Duration.ofHours(12)));
        assertFalse(checkIn.isActiveAt(NINE.plus(Duration.ofHours(1)), Duration.ofMinutes(30)));
        assertFalse(checkIn.isActiveAt(NINE.minusSeconds(1), Duration.ofHours(12)));
    }

    @Test
    void weatherSnapshotLookaheadFallsBackToCurrent() {
        WeatherHour current = new WeatherHour(60, "Clear", 0.1, 5, NINE);
        WeatherHour next = new WeatherHour(61, "Clear", 0.1, 5, NINE.plusSeconds(3600));

        assertEquals(List.of(current), new WeatherSnapshot(current, List.of()).lookahead(2));
        assertEquals(List.of(next), new WeatherSnapshot(current, List.of(next)).lookahead(2));
        assertEquals(NINE, new WeatherSnapshot(current, null).referenceTime());
        assertThrows(IllegalArgumentException.class, () -> new WeatherHour(60, "Rain", 1.5, 5, NINE));
    }

    @Test
    void routeSequenceWindowOnDate() {
        RouteSequence route = new RouteSequence("b-1", null, LocalTime.of(9, 0), Duration.ofHours(2), null);
        LocalDate monday = LocalDate.of(2024, 6, 3);

        assertEquals("b-1", route.buildingName());
        assertEquals(NINE, route.arrivalOn(monday, ZoneOffset.UTC));
        assertTrue(route.windowContains(monday, ZoneOffset.UTC, NINE.plus(Duration.ofMinutes(90))));
        assertFalse(route.windowContains(monday, ZoneOffset.UTC, NINE.plus(Duration.ofMinutes(121))));
        assertEquals(DayOfWeek.MONDAY, monday.getDayOfWeek());
    }

    @Test
    void daySchedulesTotalHoursAndWeeklyPlanRejectsDuplicateDays() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        DaySchedule schedule = DaySchedule.of(day, List.of(
                entry("a", "b-1", null, "one", NINE),
                entry("b", "b-1", null, "two", NINE.plus(Duration.ofHours(2)))
        ));

        assertEquals(2.0, schedule.totalHours(), 1e-9);
        assertEquals(2.0, new WeeklyPlan(List.of(schedule, DaySchedule.empty(day.plusDays(1)))).totalHours(), 1e-9);
        assertTrue(new WeeklyPlan(List.of(schedule)).day(day).isPresent());
        assertThrows(IllegalArgumentException.class, () -> new WeeklyPlan(List.of(schedule, DaySchedule.empty(day))));
    }

    @Test
    void placeholderBuildingsAreCoverage() {
        BuildingSummary placeholder = BuildingSummary.placeholder("b-9");

        assertEquals("b-9", placeholder.name());
        assertEquals(BuildingStatus.COVERAGE, placeholder.status());
        assertEquals(BuildingStatus.CURRENT, placeholder.withStatus(BuildingStatus.CURRENT).status());
    }

    @Test
    void eventsExposeTypeAndPayload() {
        PlanComputed computed = new PlanComputed(NINE, "w", LocalDate.of(2024, 6, 3), 4, "b-1", 2, 1, 15);
        PlanRefreshFailed failed = new PlanRefreshFailed(NINE, "w", 5, "boom");
        CurrentBuildingChanged changed = new CurrentBuildingChanged(NINE, "w", null, "b-1", "active-window");
        PlanIssueRaised issue = new PlanIssueRaised(NINE, "w", "MISSING_DATA", "none", Map.of("subjectId", "2024-06-03"));

        assertEquals("PlanComputed", computed.type());
        assertEquals("PlanRefreshFailed", failed.type());
        assertEquals("CurrentBuildingChanged", changed.type());
        assertEquals("PlanIssueRaised", issue.type());
        assertEquals(4, computed.generation());
        assertEquals("2024-06-03", issue.details().get("subjectId"));
        assertEquals(IssueKind.MISSING_DATA, PlanIssue.missingData("d", "m").kind());
    }

    private static ScheduleEntry entry(String id, String buildingId, String circuitId, String title, Instant start) {
        return new ScheduleEntry(id, buildingId, circuitId, title, "Cleaning", start, start.plus(Duration.ofHours(1)),
                1, Urgency.NORMAL, EntryOrigin.ROUTINE);
    }
}
