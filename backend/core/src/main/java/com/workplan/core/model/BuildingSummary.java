package com.workplan.core.model;

import java.util.Objects;

public record BuildingSummary(
        String id,
        String name,
        String address,
        Coordinate coordinate,
        BuildingStatus status
) {
    public BuildingSummary {
        Objects.requireNonNull(id, "id is required");
        name = name == null ? id : name;
        address = address == null ? "" : address;
        status = status == null ? BuildingStatus.ASSIGNED : status;
    }

    public static BuildingSummary placeholder(String id) {
        return new BuildingSummary(id, id, "", null, BuildingStatus.COVERAGE);
    }

    public BuildingSummary withStatus(BuildingStatus next) {
        return new BuildingSummary(id, name, address, coordinate, next);
    }
}
