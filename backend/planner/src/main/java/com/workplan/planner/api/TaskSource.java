package com.workplan.planner.api;

import com.workplan.core.model.Task;

import java.time.LocalDate;
import java.util.List;

public interface TaskSource {
    List<Task> getTasks(String workerId, LocalDate date);
}
