package com.university.coursescheduler.solver;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    NOT_SOLVED,
    ABORTED;

    public boolean isOptimal() {
        return this == OPTIMAL;
    }
}
