package com.university.coursescheduler.model;

public class TimeSlot {

    private final int ordinal;
    private final String code;
    private final DayPattern dayPattern;
    private final String startTime;
    private final String endTime;

    public TimeSlot(int ordinal, String code, DayPattern dayPattern, String startTime, String endTime) {
        this.ordinal = ordinal;
        this.code = code;
        this.dayPattern = dayPattern;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getCode() {
        return code;
    }

    public DayPattern getDayPattern() {
        return dayPattern;
    }

    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    // e.g. "TT 3:00-4:15"
    public String getLabel() {
        return dayPattern.name() + " " + startTime + "-" + endTime;
    }

    @Override
    public String toString() {
        return "TimeSlot{" +
                "ordinal=" + ordinal +
                ", code='" + code + '\'' +
                ", label='" + getLabel() + '\'' +
                '}';
    }
}
