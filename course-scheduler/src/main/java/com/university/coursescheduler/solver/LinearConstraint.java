package com.university.coursescheduler.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded linear row {@code lowerBound <= sum(coefficient * variable) <= upperBound}.
 * Variables are referenced by the index {@link LinearModel#addBoolVar(String)} returned.
 */
public class LinearConstraint {

    private final String name;
    private final double lowerBound;
    private final double upperBound;
    private final Map<Integer, Double> coefficients = new LinkedHashMap<>();

    LinearConstraint(String name, double lowerBound, double upperBound) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Constraint " + name + " has lower bound above upper bound");
        }
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /**
     * Adds {@code coefficient} to the variable's coefficient in this row.
     */
    public LinearConstraint addTerm(int variable, double coefficient) {
        coefficients.merge(variable, coefficient, Double::sum);
        return this;
    }

    public String getName() {
        return name;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public Map<Integer, Double> getCoefficients() {
        return Collections.unmodifiableMap(coefficients);
    }
}
