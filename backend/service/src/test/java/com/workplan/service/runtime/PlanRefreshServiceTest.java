package com.workplan.service.runtime;

import com.workplan.core.bus.EventBus;
import com.workplan.core.events.CurrentBuildingChanged;
import com.workplan.core.events.PlanComputed;
import com.workplan.core.events.PlanIssueRaised;
import com.workplan.core.events.PlanRefreshFailed;
import com.workplan.planner.api.TaskSource;
import com.workplan.planner.config.PlannerSettings;
import com.workplan.planner.plan.DailyPlan;
import com.workplan.planner.plan.DailyPlanOrchestrator;
import com.workplan.service.source.JsonFixtureSources;
import com.workplan.service.source.PlanInputsGatherer;
import com.workplan.service.support.EventCapture;
import com.workplan.service.support.PlanFixtures;
import com.workplan.service.support.WorkdayClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanRefreshServiceTest {
    private static final Instant START = Instant.parse("2024-06-03T13:30:00Z");

    private final JsonFixtureSources sources = PlanFixtures.utcSources();
    private final WorkdayClock clock = new WorkdayClock(START, ZoneOffset.UTC);
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final AtomicBoolean tasksDown = new AtomicBoolean();
    private final AtomicInteger gatherCount = new AtomicInteger();
    private PlanRefreshService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void refreshPublishesPlanAndBindsAccessors() {
        service = service(Duration.ofMillis(50));

        DailyPlan plan = service.refreshNow().orElseThrow();

        assertEquals("b-1", service.currentBuilding().orElseThrow().id());
        assertEquals(plan.orderedUpcoming(), service.orderedUpcoming());
        assertEquals(7, service.weeklyPlan().orElseThrow().days().size());
        assertEquals(1, service.acceptedGeneration());

        PlanComputed computed = capture.byType(PlanComputed.class).get(0);
        assertEquals(1, computed.generation());
        assertEquals("b-1", computed.currentBuildingId());
        assertEquals(plan.orderedUpcoming().size(), computed.upcomingCount());

        CurrentBuildingChanged changed = capture.byType(CurrentBuildingChanged.class).get(0);
        assertNull(changed.previousBuildingId());
        assertEquals("active-window", changed.resolvedBy());
        assertEquals(plan.issues().size(), capture.byType(PlanIssueRaised.class).size());
        assertEquals(5, plan.issues().size());
    }

    @Test
    void buildingChangeIsPublishedOnlyWhenTheBuildingMoves() {
        service = service(Duration.ofMillis(50));

        service.refreshNow();
        service.refreshNow();
        assertEquals(1, capture.byType(CurrentBuildingChanged.class).size());

        clock.moveTo(LocalTime.of(15, 15));
        service.refreshNow();

        List<CurrentBuildingChanged> changes = capture.byType(CurrentBuildingChanged.class);
        assertEquals(2, changes.size());
        assertEquals("b-1", changes.get(1).previousBuildingId());
        assertEquals("b-2", changes.get(1).buildingId());
        assertEquals(3, capture.byType(PlanComputed.class).size());
    }

    @Test
    void failedRefreshKeepsPreviousPlan() {
        service = service(Duration.ofMillis(50));
        DailyPlan first = service.refreshNow().orElseThrow();

        tasksDown.set(true);
        DailyPlan afterFailure = service.refreshNow().orElseThrow();

        assertSame(first, afterFailure);
        assertEquals(1, service.acceptedGeneration());
        PlanRefreshFailed failed = capture.byType(PlanRefreshFailed.class).get(0);
        assertEquals(2, failed.generation());
        assertEquals("task feed down", failed.message());
        assertEquals(1, capture.byType(PlanComputed.class).size());
    }

    @Test
    void failureBeforeAnyPlanLeavesNothingToShow() {
        service = service(Duration.ofMillis(50));
        tasksDown.set(true);

        assertTrue(service.refreshNow().isEmpty());
        assertTrue(service.currentBuilding().isEmpty());
        assertTrue(service.orderedUpcoming().isEmpty());
        assertTrue(service.weeklyPlan().isEmpty());
    }

    @Test
    void staleGenerationIsDiscarded() {
        service = service(Duration.ofMillis(50));
        DailyPlan plan = service.refreshNow().orElseThrow();
        clock.moveTo(LocalTime.of(15, 15));
        DailyPlan newer = service.refreshNow().orElseThrow();

        assertFalse(service.accept(1, plan, 0));
        assertSame(newer, service.latestPlan().orElseThrow());
        assertTrue(service.accept(10, plan, 0));
        assertEquals(10, service.acceptedGeneration());
        assertSame(plan, service.latestPlan().orElseThrow());
    }

    @Test
    void burstOfRequestsIsDebouncedIntoOneRefresh() throws Exception {
        service = service(Duration.ofMillis(150));

        for (int i = 0; i < 5; i++) {
            service.requestRefresh();
        }
        awaitPlans(1, Duration.ofSeconds(5));
        Thread.sleep(400);

        assertEquals(1, gatherCount.get());
        assertEquals(1, capture.byType(PlanComputed.class).size());
    }

    @Test
    void periodicRefreshKeepsProducingPlans() throws Exception {
        service = service(Duration.ofMillis(10));

        service.start(Duration.ofMillis(20));
        awaitPlans(2, Duration.ofSeconds(5));

        assertTrue(service.acceptedGeneration() >= 2);
    }

    private void awaitPlans(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (capture.byType(PlanComputed.class).size() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(capture.byType(PlanComputed.class).size() >= count, "timed out waiting for plans");
    }

    private PlanRefreshService service(Duration debounce) {
        TaskSource tasks = (workerId, date) -> {
            if (tasksDown.get()) {
                throw new IllegalStateException("task feed down");
            }
            return sources.getTasks(workerId, date);
        };
        PlanInputsGatherer gatherer = new PlanInputsGatherer(
                sources,
                tasks,
                sources,
                sources,
                sources,
                workerId -> {
                    gatherCount.incrementAndGet();
                    return sources.getAssignedBuildings(workerId);
                },
                sources
        );
        DailyPlanOrchestrator orchestrator = new DailyPlanOrchestrator(PlannerSettings.forZone(ZoneOffset.UTC), clock);
        return new PlanRefreshService("worker-1", gatherer, orchestrator, bus, clock, debounce);
    }
}
