package com.workplan.planner.weather;

import java.util.List;

public enum SuggestionKind {
    COLLECTION(0, List.of("Stage bins at the curb line", "Confirm lids are closed", "Photograph set-out")),
    RAIN(1, List.of("Check roof and curb drains", "Lay lobby mats", "Spot clean instead of hosing")),
    SNOW(1, List.of("Salt entrances and ramps", "Clear the walkway to the curb", "Re-check within 4 hours")),
    WIND(1, List.of("Secure trash lids", "Tie off loose bags", "Check awnings and signage")),
    INDOOR(1, List.of("Sweep and mop the lobby", "Wipe stairwell rails", "Check the laundry room")),
    HEAT(2, List.of("Hose and squeegee sidewalks", "Hydrate between stops")),
    GENERIC(2, List.of("Sweep sidewalk and curb", "Clear tree pits", "Inspect the exterior"));

    private final int rank;
    private final List<String> checklist;

    SuggestionKind(int rank, List<String> checklist) {
        this.rank = rank;
        this.checklist = checklist;
    }

    public int rank() {
        return rank;
    }

    public List<String> checklist() {
        return checklist;
    }
}
