package com.workplan.planner.api;

import com.workplan.core.model.CheckIn;

import java.util.Optional;

public interface CheckInSource {
    Optional<CheckIn> getActiveCheckIn(String workerId);
}
