package com.workplan.planner.api;

import com.workplan.core.model.BuildingSummary;

import java.util.List;

public interface AssignedBuildingSource {
    List<BuildingSummary> getAssignedBuildings(String workerId);
}
