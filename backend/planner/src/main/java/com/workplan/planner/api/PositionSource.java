package com.workplan.planner.api;

import com.workplan.core.model.Coordinate;

import java.util.Optional;

public interface PositionSource {
    Optional<Coordinate> getCurrentPosition();
}
