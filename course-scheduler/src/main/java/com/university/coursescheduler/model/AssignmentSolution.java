package com.university.coursescheduler.model;

import java.util.Collections;
import java.util.List;

public class AssignmentSolution {

    private final List<ScheduleEntry> entries;
    private final double satisfactionTotal;
    private final long solveTimeMillis;

    public AssignmentSolution(List<ScheduleEntry> entries, double satisfactionTotal, long solveTimeMillis) {
        this.entries = Collections.unmodifiableList(entries);
        this.satisfactionTotal = satisfactionTotal;
        this.solveTimeMillis = solveTimeMillis;
    }

    public static AssignmentSolution empty() {
        return new AssignmentSolution(Collections.emptyList(), 0, 0);
    }

    public List<ScheduleEntry> getEntries() {
        return entries;
    }

    public double getSatisfactionTotal() {
        return satisfactionTotal;
    }

    public long getSolveTimeMillis() {
        return solveTimeMillis;
    }
}
