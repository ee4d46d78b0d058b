package com.workplan.planner.calendar;

import com.workplan.core.model.EntryOrigin;
import com.workplan.core.model.ScheduleEntry;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class CalendarTaskInjector {
    private final ZoneId zone;

    public CalendarTaskInjector(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    public List<ScheduleEntry> inject(
            LocalDate date,
            String workerId,
            List<CollectionRule> rules,
            List<ScheduleEntry> existingEntries
    ) {
        Objects.requireNonNull(date, "date is required");
        if (rules == null || rules.isEmpty() || workerId == null) {
            return List.of();
        }
        Set<ScheduleEntry.DedupKey> present = new HashSet<>();
        if (existingEntries != null) {
            for (ScheduleEntry entry : existingEntries) {
                present.add(entry.dedupKey());
            }
        }

        List<ScheduleEntry> injected = new ArrayList<>();
        for (CollectionRule rule : rules) {
            if (!rule.firesOn(date.getDayOfWeek(), workerId)) {
                continue;
            }
            Instant start = date.atTime(rule.windowStart()).atZone(zone).toInstant();
            LocalDate endDate = rule.windowEnd().isBefore(rule.windowStart()) ? date.plusDays(1) : date;
            Instant end = endDate.atTime(rule.windowEnd()).atZone(zone).toInstant();
            for (String buildingId : rule.buildingGroup()) {
                ScheduleEntry entry = new ScheduleEntry(
                        rule.circuitId() + ":" + buildingId + ":" + date,
                        buildingId,
                        rule.circuitId(),
                        rule.title(),
                        rule.category(),
                        start,
                        end,
                        1,
                        rule.urgency(),
                        EntryOrigin.CALENDAR_RULE
                );
                if (present.add(entry.dedupKey())) {
                    injected.add(entry);
                }
            }
        }
        return List.copyOf(injected);
    }
}
