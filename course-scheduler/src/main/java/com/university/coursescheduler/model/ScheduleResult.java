package com.university.coursescheduler.model;

import java.util.List;
import java.util.Map;

public class ScheduleResult {

    private final List<ScheduleEntry> entries;
    private final double satisfactionTotal;
    private final double kemenyScore;
    private final Map<String, Double> slotPopularity;
    private final long solveTimeMillis;
    private final ScheduleStats stats;

    public ScheduleResult(List<ScheduleEntry> entries, double satisfactionTotal, double kemenyScore,
            Map<String, Double> slotPopularity, long solveTimeMillis, ScheduleStats stats) {
        this.entries = entries;
        this.satisfactionTotal = satisfactionTotal;
        this.kemenyScore = kemenyScore;
        this.slotPopularity = slotPopularity;
        this.solveTimeMillis = solveTimeMillis;
        this.stats = stats;
    }

    public List<ScheduleEntry> getEntries() {
        return entries;
    }

    public double getSatisfactionTotal() {
        return satisfactionTotal;
    }

    public double getKemenyScore() {
        return kemenyScore;
    }

    public Map<String, Double> getSlotPopularity() {
        return slotPopularity;
    }

    public long getSolveTimeMillis() {
        return solveTimeMillis;
    }

    public ScheduleStats getStats() {
        return stats;
    }
}
