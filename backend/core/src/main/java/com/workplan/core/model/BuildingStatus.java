package com.workplan.core.model;

public enum BuildingStatus {
    CURRENT,
    ASSIGNED,
    AVAILABLE,
    COVERAGE,
    UNAVAILABLE
}
