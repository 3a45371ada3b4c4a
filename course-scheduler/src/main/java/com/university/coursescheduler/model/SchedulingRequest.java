package com.university.coursescheduler.model;

import java.util.List;

/**
 * Everything one optimization run needs. Each run reads only from its own
 * request; nothing is remembered between runs.
 */
public class SchedulingRequest {
    private List<FacultyMember> faculty;
    private List<CourseFaculty> courses;
    private List<CoursePreference> selection;
    private Long seed;
    private Long consensusTimeLimitMillis;
    private Long assignmentTimeLimitMillis;

    public SchedulingRequest() {
    }

    public SchedulingRequest(List<FacultyMember> faculty, List<CourseFaculty> courses,
            List<CoursePreference> selection, Long seed) {
        this.faculty = faculty;
        this.courses = courses;
        this.selection = selection;
        this.seed = seed;
    }

    public List<FacultyMember> getFaculty() {
        return faculty;
    }

    public void setFaculty(List<FacultyMember> faculty) {
        this.faculty = faculty;
    }

    public List<CourseFaculty> getCourses() {
        return courses;
    }

    public void setCourses(List<CourseFaculty> courses) {
        this.courses = courses;
    }

    public List<CoursePreference> getSelection() {
        return selection;
    }

    public void setSelection(List<CoursePreference> selection) {
        this.selection = selection;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Long getConsensusTimeLimitMillis() {
        return consensusTimeLimitMillis;
    }

    public void setConsensusTimeLimitMillis(Long consensusTimeLimitMillis) {
        this.consensusTimeLimitMillis = consensusTimeLimitMillis;
    }

    public Long getAssignmentTimeLimitMillis() {
        return assignmentTimeLimitMillis;
    }

    public void setAssignmentTimeLimitMillis(Long assignmentTimeLimitMillis) {
        this.assignmentTimeLimitMillis = assignmentTimeLimitMillis;
    }
}
