package com.university.coursescheduler.solver;

import java.util.Arrays;

/**
 * What a backend hands back: the status, the variable values (empty unless a
 * solution was found) and the objective value.
 */
public class SolveResult {

    private final SolveStatus status;
    private final double[] values;
    private final double objectiveValue;
    private final long wallTimeMillis;

    public SolveResult(SolveStatus status, double[] values, double objectiveValue, long wallTimeMillis) {
        this.status = status;
        this.values = values != null ? values.clone() : new double[0];
        this.objectiveValue = objectiveValue;
        this.wallTimeMillis = wallTimeMillis;
    }

    public static SolveResult withoutSolution(SolveStatus status, long wallTimeMillis) {
        return new SolveResult(status, new double[0], Double.NaN, wallTimeMillis);
    }

    public SolveStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status.isOptimal();
    }

    public boolean hasSolution() {
        return values.length > 0;
    }

    public double getValue(int variable) {
        return values[variable];
    }

    /**
     * Reads a boolean variable, with tolerance for floating point noise.
     */
    public boolean isSet(int variable) {
        return values[variable] > 0.5;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public long getWallTimeMillis() {
        return wallTimeMillis;
    }

    @Override
    public String toString() {
        return "SolveResult{" +
                "status=" + status +
                ", objectiveValue=" + objectiveValue +
                ", wallTimeMillis=" + wallTimeMillis +
                ", values=" + Arrays.toString(values) +
                '}';
    }
}
