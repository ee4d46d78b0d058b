package com.workplan.planner.policy;

import com.workplan.core.model.Task;

import java.util.Locale;

public record TaskPolicyRule(String workerId, String buildingId, String category, boolean requiresPhoto) {

    public boolean matches(String worker, Task task) {
        if (workerId != null && !workerId.equals(worker)) {
            return false;
        }
        if (buildingId != null && !buildingId.equals(task.buildingId())) {
            return false;
        }
        return category == null
                || category.trim().toLowerCase(Locale.ROOT).equals(task.category().trim().toLowerCase(Locale.ROOT));
    }
}
