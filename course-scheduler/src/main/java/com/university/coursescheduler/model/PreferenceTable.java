package com.university.coursescheduler.model;

import com.university.coursescheduler.exception.MalformedInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated course x slot rank matrix. Row order is the order courses were
 * supplied in and is kept throughout the pipeline.
 */
public class PreferenceTable {

    private final List<String> courses;
    private final int[][] ranks;
    private final int slotCount;

    private PreferenceTable(List<String> courses, int[][] ranks, int slotCount) {
        this.courses = courses;
        this.ranks = ranks;
        this.slotCount = slotCount;
    }

    /**
     * Builds the table from raw rows, rejecting rows of the wrong width,
     * negative or missing ranks, blank course names and duplicate courses.
     */
    public static PreferenceTable of(List<CoursePreference> rows, int slotCount) {
        if (rows == null) {
            throw new MalformedInputException("Selection data is required");
        }
        List<String> courses = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int[][] ranks = new int[rows.size()][];

        for (int i = 0; i < rows.size(); i++) {
            CoursePreference row = rows.get(i);
            String course = row.getCourse() == null ? "" : row.getCourse().trim();
            if (course.isEmpty()) {
                throw new MalformedInputException("Selection row " + (i + 1) + " has no course name");
            }
            if (!seen.add(course)) {
                throw new MalformedInputException("Course " + course + " appears more than once in selection data");
            }
            List<Integer> rowRanks = row.getRanks();
            if (rowRanks == null || rowRanks.size() != slotCount) {
                throw new MalformedInputException("Course " + course + " must rank exactly " + slotCount
                        + " slots but has " + (rowRanks == null ? 0 : rowRanks.size()));
            }
            ranks[i] = new int[slotCount];
            for (int s = 0; s < slotCount; s++) {
                Integer rank = rowRanks.get(s);
                if (rank == null || rank < 0) {
                    throw new MalformedInputException("Course " + course + " has an invalid rank for slot "
                            + (s + 1) + ": " + rank);
                }
                ranks[i][s] = rank;
            }
            courses.add(course);
        }
        return new PreferenceTable(Collections.unmodifiableList(courses), ranks, slotCount);
    }

    public List<String> getCourses() {
        return courses;
    }

    public int getCourseCount() {
        return courses.size();
    }

    public int getSlotCount() {
        return slotCount;
    }

    public int getRank(int course, int slot) {
        return ranks[course][slot];
    }

    public boolean isDegenerate(int course) {
        for (int rank : ranks[course]) {
            if (rank != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rows that rank at least one slot, i.e. the voters for consensus ranking.
     */
    public int[][] getVotingRows() {
        List<int[]> voters = new ArrayList<>();
        for (int i = 0; i < ranks.length; i++) {
            if (!isDegenerate(i)) {
                voters.add(ranks[i].clone());
            }
        }
        return voters.toArray(new int[0][]);
    }
}
