package com.workplan.core.model;

public enum EntryOrigin {
    ROUTINE,
    AD_HOC,
    ROUTE,
    CALENDAR_RULE
}
