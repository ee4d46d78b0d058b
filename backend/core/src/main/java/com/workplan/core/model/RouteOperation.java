package com.workplan.core.model;

public record RouteOperation(
        String id,
        String name,
        String category,
        boolean requiresPhoto
) {
}
