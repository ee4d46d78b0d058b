package com.workplan.core.model;

public enum IssueKind {
    MISSING_DATA,
    AMBIGUOUS_BUILDING,
    INVALID_TIME_WINDOW
}
