package com.workplan.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.workplan.core.util.JsonUtils;
import com.workplan.planner.calendar.CollectionRule;
import com.workplan.planner.config.PlannerSettings;
import com.workplan.planner.policy.TaskPolicyRule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static PlannerSettings loadPlannerSettings(Path configDir) {
        PlannerSettings settings = read(configDir.resolve("planner.json"), new TypeReference<>() {
        });
        return settings == null ? PlannerSettings.defaults() : settings;
    }

    public static List<CollectionRule> loadCollectionRules(Path configDir) {
        List<CollectionRule> rules = read(configDir.resolve("collection-rules.json"), new TypeReference<>() {
        });
        return rules == null ? List.of() : List.copyOf(rules);
    }

    public static List<TaskPolicyRule> loadTaskPolicies(Path configDir) {
        Path path = configDir.resolve("task-policies.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TaskPolicyRule> rules = read(path, new TypeReference<>() {
        });
        return rules == null ? List.of() : List.copyOf(rules);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
