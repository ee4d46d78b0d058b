package com.workplan.core.model;

import java.util.Locale;

public enum Urgency {
    LOW,
    NORMAL,
    HIGH,
    URGENT,
    CRITICAL,
    EMERGENCY;

    public boolean isAtLeast(Urgency other) {
        return compareTo(other) >= 0;
    }

    public static Urgency max(Urgency a, Urgency b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Urgency fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return NORMAL;
        }
    }
}
