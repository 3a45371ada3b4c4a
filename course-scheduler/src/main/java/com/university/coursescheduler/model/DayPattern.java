package com.university.coursescheduler.model;

public enum DayPattern {
    MWF("M/W/F"),
    TT("T/TH");

    private final String days;

    DayPattern(String days) {
        this.days = days;
    }

    public String getDays() {
        return days;
    }
}
