package com.university.coursescheduler.model;

import java.util.Map;

/**
 * Descriptive counts over a realized schedule. Purely informational; the
 * balance flags compare the differences against the configured report limit.
 */
public class ScheduleStats {

    private final Map<String, Integer> dayPatternCounts;
    private final Map<String, Integer> startTimeCounts;
    private final Map<String, Integer> slotCounts;
    private final int balanceDiff;
    private final int timeDiff;
    private final boolean dayBalanceWithinLimit;
    private final boolean startTimeBalanceWithinLimit;

    public ScheduleStats(Map<String, Integer> dayPatternCounts, Map<String, Integer> startTimeCounts,
            Map<String, Integer> slotCounts, int balanceDiff, int timeDiff,
            boolean dayBalanceWithinLimit, boolean startTimeBalanceWithinLimit) {
        this.dayPatternCounts = dayPatternCounts;
        this.startTimeCounts = startTimeCounts;
        this.slotCounts = slotCounts;
        this.balanceDiff = balanceDiff;
        this.timeDiff = timeDiff;
        this.dayBalanceWithinLimit = dayBalanceWithinLimit;
        this.startTimeBalanceWithinLimit = startTimeBalanceWithinLimit;
    }

    public Map<String, Integer> getDayPatternCounts() {
        return dayPatternCounts;
    }

    public Map<String, Integer> getStartTimeCounts() {
        return startTimeCounts;
    }

    public Map<String, Integer> getSlotCounts() {
        return slotCounts;
    }

    public int getBalanceDiff() {
        return balanceDiff;
    }

    public int getTimeDiff() {
        return timeDiff;
    }

    public boolean isDayBalanceWithinLimit() {
        return dayBalanceWithinLimit;
    }

    public boolean isStartTimeBalanceWithinLimit() {
        return startTimeBalanceWithinLimit;
    }
}
