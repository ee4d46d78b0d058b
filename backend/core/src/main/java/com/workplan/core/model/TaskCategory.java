package com.workplan.core.model;

import java.util.Locale;

public enum TaskCategory {
    CLEANING,
    SANITATION,
    OPERATIONS,
    MAINTENANCE,
    REPAIR,
    INSPECTION,
    UNKNOWN;

    public static TaskCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return UNKNOWN;
        }
    }
}
