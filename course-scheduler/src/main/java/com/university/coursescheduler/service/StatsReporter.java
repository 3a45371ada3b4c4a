package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.model.DayPattern;
import com.university.coursescheduler.model.ScheduleEntry;
import com.university.coursescheduler.model.ScheduleStats;
import com.university.coursescheduler.model.TimeSlot;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StatsReporter {

    private final SlotCatalog catalog;
    private final SchedulerProperties properties;

    public StatsReporter(SlotCatalog catalog, SchedulerProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    public ScheduleStats report(List<ScheduleEntry> entries) {
        Map<String, Integer> dayPatternCounts = new LinkedHashMap<>();
        for (DayPattern pattern : catalog.slotsByDayPattern().keySet()) {
            dayPatternCounts.put(pattern.name(), 0);
        }
        Map<String, Integer> startTimeCounts = new LinkedHashMap<>();
        for (String startTime : catalog.slotsByStartTime().keySet()) {
            startTimeCounts.put(startTime, 0);
        }
        Map<String, Integer> slotCounts = new LinkedHashMap<>();
        for (TimeSlot slot : catalog.getSlots()) {
            slotCounts.put(slot.getCode(), 0);
        }

        for (ScheduleEntry entry : entries) {
            TimeSlot slot = catalog.slot(entry.getSlot());
            dayPatternCounts.merge(slot.getDayPattern().name(), 1, Integer::sum);
            startTimeCounts.merge(slot.getStartTime(), 1, Integer::sum);
            slotCounts.merge(slot.getCode(), 1, Integer::sum);
        }

        int balanceDiff = spread(dayPatternCounts);
        int timeDiff = spread(startTimeCounts);
        int limit = properties.getBalanceReportLimit();
        return new ScheduleStats(dayPatternCounts, startTimeCounts, slotCounts, balanceDiff, timeDiff,
                balanceDiff <= limit, timeDiff <= limit);
    }

    // With two day patterns this is |MWF - TT|.
    private static int spread(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return 0;
        }
        return Collections.max(counts.values()) - Collections.min(counts.values());
    }
}
