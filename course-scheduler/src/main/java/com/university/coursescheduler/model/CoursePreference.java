package com.university.coursescheduler.model;

import java.util.List;

/**
 * One row of the selection table: a course and its rank for each catalog slot,
 * in catalog order. Rank 0 means the slot was not ranked, 1 is the favourite.
 */
public class CoursePreference {

    private String course;
    private List<Integer> ranks;

    public CoursePreference() {
    }

    public CoursePreference(String course, List<Integer> ranks) {
        this.course = course;
        this.ranks = ranks;
    }

    public String getCourse() {
        return course;
    }

    public void setCourse(String course) {
        this.course = course;
    }

    public List<Integer> getRanks() {
        return ranks;
    }

    public void setRanks(List<Integer> ranks) {
        this.ranks = ranks;
    }
}
