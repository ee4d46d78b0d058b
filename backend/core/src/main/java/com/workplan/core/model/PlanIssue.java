package com.workplan.core.model;

import java.util.Objects;

public record PlanIssue(IssueKind kind, String subjectId, String message) {
    public PlanIssue {
        Objects.requireNonNull(kind, "kind is required");
        subjectId = subjectId == null ? "" : subjectId;
        message = message == null ? "" : message;
    }

    public static PlanIssue missingData(String subjectId, String message) {
        return new PlanIssue(IssueKind.MISSING_DATA, subjectId, message);
    }

    public static PlanIssue ambiguousBuilding(String subjectId, String message) {
        return new PlanIssue(IssueKind.AMBIGUOUS_BUILDING, subjectId, message);
    }

    public static PlanIssue invalidTimeWindow(String subjectId, String message) {
        return new PlanIssue(IssueKind.INVALID_TIME_WINDOW, subjectId, message);
    }
}
