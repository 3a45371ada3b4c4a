package com.university.coursescheduler.model;

public class SatisfactionMatrix {

    private final double[][] values;

    public SatisfactionMatrix(int courseCount, int slotCount) {
        this.values = new double[courseCount][slotCount];
    }

    public double get(int course, int slot) {
        return values[course][slot];
    }

    public void set(int course, int slot, double value) {
        values[course][slot] = value;
    }

    public int getCourseCount() {
        return values.length;
    }

    public int getSlotCount() {
        return values.length == 0 ? 0 : values[0].length;
    }
}
