package com.workplan.planner.policy;

import com.workplan.core.model.Task;

import java.util.List;

public final class TaskPolicy {
    private static final TaskPolicy NONE = new TaskPolicy(List.of());

    private final List<TaskPolicyRule> rules;

    public TaskPolicy(List<TaskPolicyRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static TaskPolicy none() {
        return NONE;
    }

    public List<TaskPolicyRule> rules() {
        return rules;
    }

    public Task apply(String workerId, Task task) {
        Task result = task;
        for (TaskPolicyRule rule : rules) {
            if (rule.matches(workerId, result)) {
                result = result.withRequiresPhoto(rule.requiresPhoto());
            }
        }
        return result;
    }

    public List<Task> applyAll(String workerId, List<Task> tasks) {
        return tasks.stream().map(task -> apply(workerId, task)).toList();
    }
}
