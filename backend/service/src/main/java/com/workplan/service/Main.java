package com.workplan.service;

import com.workplan.core.bus.EventBus;
import com.workplan.core.events.CurrentBuildingChanged;
import com.workplan.core.events.PlanIssueRaised;
import com.workplan.core.events.PlanRefreshFailed;
import com.workplan.core.util.JsonUtils;
import com.workplan.planner.calendar.CollectionRule;
import com.workplan.planner.config.PlannerSettings;
import com.workplan.planner.plan.DailyPlan;
import com.workplan.planner.plan.DailyPlanOrchestrator;
import com.workplan.planner.policy.TaskPolicy;
import com.workplan.service.config.ConfigLoader;
import com.workplan.service.runtime.PlanRefreshService;
import com.workplan.service.source.JsonFixtureSources;
import com.workplan.service.source.PlanInputsGatherer;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        Path fixtureFile = args.length > 1 ? Path.of(args[1]) : configDir.resolve("fixture.json");
        String workerId = args.length > 2 ? args[2] : "worker-1";

        PlannerSettings settings = ConfigLoader.loadPlannerSettings(configDir);
        List<CollectionRule> collectionRules = ConfigLoader.loadCollectionRules(configDir);
        TaskPolicy taskPolicy = new TaskPolicy(ConfigLoader.loadTaskPolicies(configDir));
        LOGGER.info(() -> "Loaded " + collectionRules.size() + " collection rule(s) and "
                + taskPolicy.rules().size() + " task policy rule(s) from " + configDir.toAbsolutePath());

        JsonFixtureSources sources = new JsonFixtureSources(fixtureFile, settings.zone());
        if (!sources.hasWorker(workerId)) {
            LOGGER.warning("Fixture " + fixtureFile + " has no data for worker " + workerId);
        }

        Clock clock = Clock.system(settings.zone());
        EventBus eventBus = new EventBus();
        eventBus.subscribeForWorker(CurrentBuildingChanged.class, workerId, event ->
                LOGGER.info("Current building " + event.buildingId() + " via " + event.resolvedBy()));
        eventBus.subscribeForWorker(PlanIssueRaised.class, workerId, event ->
                LOGGER.info("Plan issue " + event.kind() + ": " + event.message()));
        eventBus.subscribeForWorker(PlanRefreshFailed.class, workerId, event ->
                LOGGER.warning("Plan refresh failed: " + event.message()));

        PlanRefreshService refreshService = new PlanRefreshService(
                workerId,
                PlanInputsGatherer.of(sources),
                new DailyPlanOrchestrator(settings, collectionRules, taskPolicy, clock),
                eventBus,
                clock
        );
        try {
            DailyPlan plan = refreshService.refreshNow()
                    .orElseThrow(() -> new IllegalStateException("No plan could be built for " + workerId));
            System.out.println(JsonUtils.toPrettyJson(plan));
        } finally {
            refreshService.shutdown();
        }
    }
}
