package com.workplan.service.runtime;

import com.workplan.core.bus.EventBus;
import com.workplan.core.events.CurrentBuildingChanged;
import com.workplan.core.events.PlanComputed;
import com.workplan.core.events.PlanIssueRaised;
import com.workplan.core.events.PlanRefreshFailed;
import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.PlanIssue;
import com.workplan.core.model.WeeklyPlan;
import com.workplan.planner.api.PlanInputs;
import com.workplan.planner.plan.DailyPlan;
import com.workplan.planner.plan.DailyPlanOrchestrator;
import com.workplan.planner.weather.ScoredTask;
import com.workplan.service.source.PlanInputsGatherer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

public class PlanRefreshService {
    private static final Logger LOGGER = Logger.getLogger(PlanRefreshService.class.getName());
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(250);

    private final String workerId;
    private final PlanInputsGatherer gatherer;
    private final DailyPlanOrchestrator orchestrator;
    private final EventBus eventBus;
    private final Clock clock;
    private final long debounceMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<Accepted> accepted = new AtomicReference<>();
    private final Object pendingLock = new Object();
    private ScheduledFuture<?> pending;

    public PlanRefreshService(
            String workerId,
            PlanInputsGatherer gatherer,
            DailyPlanOrchestrator orchestrator,
            EventBus eventBus,
            Clock clock
    ) {
        this(workerId, gatherer, orchestrator, eventBus, clock, DEFAULT_DEBOUNCE);
    }

    public PlanRefreshService(
            String workerId,
            PlanInputsGatherer gatherer,
            DailyPlanOrchestrator orchestrator,
            EventBus eventBus,
            Clock clock,
            Duration debounce
    ) {
        this.workerId = Objects.requireNonNull(workerId, "workerId is required");
        this.gatherer = Objects.requireNonNull(gatherer, "gatherer is required");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.debounceMillis = Math.max(0, debounce.toMillis());
    }

    public void requestRefresh() {
        synchronized (pendingLock) {
            if (pending != null) {
                pending.cancel(false);
            }
            pending = timerExecutor.schedule(this::refreshNow, debounceMillis, TimeUnit.MILLISECONDS);
        }
    }

    public void start(Duration interval) {
        long intervalMillis = Math.max(debounceMillis, interval.toMillis());
        timerExecutor.scheduleAtFixedRate(this::refreshNow, 0, Math.max(1, intervalMillis), TimeUnit.MILLISECONDS);
    }

    public Optional<DailyPlan> refreshNow() {
        long generation = generations.incrementAndGet();
        Instant started = clock.instant();
        LocalDate date = LocalDate.ofInstant(started, orchestrator.settings().zone());
        try {
            PlanInputs inputs = gatherer.gather(workerId, date);
            DailyPlan plan = orchestrator.buildPlan(workerId, date, inputs);
            long durationMillis = Duration.between(started, clock.instant()).toMillis();
            accept(generation, plan, durationMillis);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Plan refresh " + generation + " failed for " + workerId + "; keeping previous plan", e);
            eventBus.publish(new PlanRefreshFailed(clock.instant(), workerId, generation, String.valueOf(e.getMessage())));
        }
        return latestPlan();
    }

    public Optional<DailyPlan> latestPlan() {
        Accepted current = accepted.get();
        return current == null ? Optional.empty() : Optional.of(current.plan());
    }

    public long acceptedGeneration() {
        Accepted current = accepted.get();
        return current == null ? 0 : current.generation();
    }

    public Optional<BuildingSummary> currentBuilding() {
        return latestPlan().flatMap(DailyPlan::current);
    }

    public List<ScoredTask> orderedUpcoming() {
        return latestPlan().map(DailyPlan::orderedUpcoming).orElse(List.of());
    }

    public Optional<WeeklyPlan> weeklyPlan() {
        return latestPlan().map(DailyPlan::weeklyPlan);
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean accept(long generation, DailyPlan plan, long durationMillis) {
        Accepted next = new Accepted(generation, plan);
        while (true) {
            Accepted previous = accepted.get();
            if (previous != null && previous.generation() >= generation) {
                LOGGER.fine(() -> "Discarding plan generation " + generation + "; generation "
                        + previous.generation() + " already accepted");
                return false;
            }
            if (accepted.compareAndSet(previous, next)) {
                publish(previous, next, durationMillis);
                return true;
            }
        }
    }

    private void publish(Accepted previous, Accepted next, long durationMillis) {
        DailyPlan plan = next.plan();
        Instant now = clock.instant();
        String buildingId = plan.current().map(BuildingSummary::id).orElse(null);
        eventBus.publish(new PlanComputed(
                now,
                workerId,
                plan.date(),
                next.generation(),
                buildingId,
                plan.orderedUpcoming().size(),
                plan.deferredOutdoor().size(),
                durationMillis
        ));

        String previousBuildingId = previous == null ? null : previous.plan().current().map(BuildingSummary::id).orElse(null);
        if (!Objects.equals(previousBuildingId, buildingId)) {
            eventBus.publish(new CurrentBuildingChanged(now, workerId, previousBuildingId, buildingId, plan.resolvedBy()));
        }

        for (PlanIssue issue : plan.issues()) {
            eventBus.publish(new PlanIssueRaised(
                    now,
                    workerId,
                    issue.kind().name(),
                    issue.message(),
                    Map.of("subjectId", issue.subjectId(), "generation", next.generation())
            ));
        }
    }

    private record Accepted(long generation, DailyPlan plan) {
    }
}
