package com.university.coursescheduler.model;

public class CourseFaculty {

    private String course;
    private String faculty;

    public CourseFaculty() {
    }

    public CourseFaculty(String course, String faculty) {
        this.course = course;
        this.faculty = faculty;
    }

    public String getCourse() {
        return course;
    }

    public void setCourse(String course) {
        this.course = course;
    }

    public String getFaculty() {
        return faculty;
    }

    public void setFaculty(String faculty) {
        this.faculty = faculty;
    }
}
