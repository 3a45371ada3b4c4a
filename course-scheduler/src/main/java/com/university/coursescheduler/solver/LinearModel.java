package com.university.coursescheduler.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral description of a 0/1 integer program: boolean variables,
 * bounded linear constraints and a linear objective. Built fresh for every
 * solve and handed to a {@link MipBackend}.
 */
public class LinearModel {

    private final String name;
    private final List<String> variableNames = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private final Map<Integer, Double> objective = new LinkedHashMap<>();
    private boolean maximize;

    public LinearModel(String name) {
        this.name = name;
    }

    /**
     * Declares a new boolean variable and returns its index.
     */
    public int addBoolVar(String variableName) {
        variableNames.add(variableName);
        return variableNames.size() - 1;
    }

    public LinearConstraint addConstraint(double lowerBound, double upperBound, String constraintName) {
        LinearConstraint constraint = new LinearConstraint(constraintName, lowerBound, upperBound);
        constraints.add(constraint);
        return constraint;
    }

    public LinearConstraint addAtMost(double upperBound, String constraintName) {
        return addConstraint(Double.NEGATIVE_INFINITY, upperBound, constraintName);
    }

    public LinearConstraint addAtLeast(double lowerBound, String constraintName) {
        return addConstraint(lowerBound, Double.POSITIVE_INFINITY, constraintName);
    }

    public LinearConstraint addEquality(double value, String constraintName) {
        return addConstraint(value, value, constraintName);
    }

    /**
     * Adds {@code coefficient} to the variable's objective coefficient. Repeated
     * calls for the same variable accumulate.
     */
    public void addObjectiveTerm(int variable, double coefficient) {
        checkVariable(variable);
        objective.merge(variable, coefficient, Double::sum);
    }

    public void maximize() {
        this.maximize = true;
    }

    public void minimize() {
        this.maximize = false;
    }

    public boolean isMaximize() {
        return maximize;
    }

    public boolean hasObjectiveTerms() {
        return !objective.isEmpty();
    }

    public String getName() {
        return name;
    }

    public int getVariableCount() {
        return variableNames.size();
    }

    public String getVariableName(int variable) {
        return variableNames.get(variable);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Map<Integer, Double> getObjective() {
        return Collections.unmodifiableMap(objective);
    }

    private void checkVariable(int variable) {
        if (variable < 0 || variable >= variableNames.size()) {
            throw new IllegalArgumentException("Unknown variable index " + variable + " in model " + name);
        }
    }
}
