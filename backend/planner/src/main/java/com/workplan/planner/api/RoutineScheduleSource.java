package com.workplan.planner.api;

import com.workplan.core.model.RoutineInstance;

import java.time.LocalDate;
import java.util.List;

public interface RoutineScheduleSource {
    List<RoutineInstance> getRoutineInstances(String workerId, LocalDate from, LocalDate toInclusive);
}
