package com.university.coursescheduler.model;

public class ScheduleEntry {

    private final String course;
    private final String slot;
    private final String time;
    private final double satisfaction;

    public ScheduleEntry(String course, String slot, String time, double satisfaction) {
        this.course = course;
        this.slot = slot;
        this.time = time;
        this.satisfaction = satisfaction;
    }

    public String getCourse() {
        return course;
    }

    public String getSlot() {
        return slot;
    }

    public String getTime() {
        return time;
    }

    public double getSatisfaction() {
        return satisfaction;
    }

    @Override
    public String toString() {
        return "ScheduleEntry{" +
                "course='" + course + '\'' +
                ", slot='" + slot + '\'' +
                ", time='" + time + '\'' +
                ", satisfaction=" + satisfaction +
                '}';
    }
}
