package com.university.coursescheduler.model;

/**
 * One row of the faculty roster. The adjustment weight is carried through from
 * the uploaded table but takes no part in optimization.
 */
public class FacultyMember {

    private String name;
    private double adjustment;
    private boolean voting;

    public FacultyMember() {
    }

    public FacultyMember(String name, double adjustment, boolean voting) {
        this.name = name;
        this.adjustment = adjustment;
        this.voting = voting;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getAdjustment() {
        return adjustment;
    }

    public void setAdjustment(double adjustment) {
        this.adjustment = adjustment;
    }

    public boolean isVoting() {
        return voting;
    }

    public void setVoting(boolean voting) {
        this.voting = voting;
    }
}
