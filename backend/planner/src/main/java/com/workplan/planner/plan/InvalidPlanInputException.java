package com.workplan.planner.plan;

public class InvalidPlanInputException extends IllegalArgumentException {
    public InvalidPlanInputException(String message) {
        super(message);
    }
}
