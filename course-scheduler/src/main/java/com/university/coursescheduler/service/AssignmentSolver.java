package com.university.coursescheduler.service;

import com.university.coursescheduler.exception.OptimizationFailedException;
import com.university.coursescheduler.exception.SolverFaultException;
import com.university.coursescheduler.model.AssignmentSolution;
import com.university.coursescheduler.model.DayPattern;
import com.university.coursescheduler.model.SatisfactionMatrix;
import com.university.coursescheduler.model.ScheduleEntry;
import com.university.coursescheduler.model.TimeSlot;
import com.university.coursescheduler.solver.LinearConstraint;
import com.university.coursescheduler.solver.LinearModel;
import com.university.coursescheduler.solver.MipBackend;
import com.university.coursescheduler.solver.SolveOptions;
import com.university.coursescheduler.solver.SolveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every course to one slot, maximizing total satisfaction while
 * keeping the day patterns and start times balanced and keeping voting
 * faculty out of the meeting slot.
 */
@Service
public class AssignmentSolver {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSolver.class);

    private static final int START_TIME_TOLERANCE = 2;

    private final MipBackend backend;
    private final SlotCatalog catalog;

    public AssignmentSolver(MipBackend backend, SlotCatalog catalog) {
        this.backend = backend;
        this.catalog = catalog;
    }

    /**
     * @param courses       course names, in satisfaction matrix row order
     * @param satisfaction  course x slot satisfaction, slots in catalog order
     * @param votingCourses row indexes of courses taught by voting faculty
     * @throws OptimizationFailedException if the model is not solved to optimality
     */
    public AssignmentSolution solve(List<String> courses, SatisfactionMatrix satisfaction,
            Set<Integer> votingCourses, SolveOptions options) {
        int courseCount = courses.size();
        int slotCount = catalog.size();
        if (courseCount == 0) {
            logger.info("No courses to assign");
            return AssignmentSolution.empty();
        }

        LinearModel model = new LinearModel("CourseAssignment");
        int[][] x = new int[slotCount][courseCount];
        for (int s = 0; s < slotCount; s++) {
            for (int c = 0; c < courseCount; c++) {
                x[s][c] = model.addBoolVar("x[" + s + "," + c + "]");
                model.addObjectiveTerm(x[s][c], satisfaction.get(c, s));
            }
        }
        model.maximize();

        for (int c = 0; c < courseCount; c++) {
            LinearConstraint oneSlot = model.addEquality(1, "one_slot_" + c);
            for (int s = 0; s < slotCount; s++) {
                oneSlot.addTerm(x[s][c], 1);
            }
        }

        int patternMin = (courseCount + 1) / 2 - 1;
        for (Map.Entry<DayPattern, List<TimeSlot>> group : catalog.slotsByDayPattern().entrySet()) {
            LinearConstraint row = model.addAtLeast(patternMin, "pattern_" + group.getKey());
            addGroupTerms(row, group.getValue(), x, courseCount);
        }

        Map<String, List<TimeSlot>> startTimes = catalog.slotsByStartTime();
        int startMin = courseCount / startTimes.size();
        int startMax = startMin + START_TIME_TOLERANCE;
        for (Map.Entry<String, List<TimeSlot>> group : startTimes.entrySet()) {
            LinearConstraint row = model.addConstraint(startMin, startMax, "start_" + group.getKey());
            addGroupTerms(row, group.getValue(), x, courseCount);
        }

        if (!votingCourses.isEmpty()) {
            int exclusion = catalog.indexOf(catalog.getExclusionSlot());
            LinearConstraint row = model.addEquality(0, "meeting_slot");
            for (int c : votingCourses) {
                row.addTerm(x[exclusion][c], 1);
            }
            logger.info("Keeping {} voting faculty courses out of {}", votingCourses.size(),
                    catalog.getExclusionSlot().getLabel());
        }

        logger.info("Assigning {} courses: day pattern floor {}, start time band [{}, {}]",
                courseCount, patternMin, startMin, startMax);

        SolveResult result = backend.solve(model, options);
        if (!result.isOptimal()) {
            logger.warn("Course assignment ended with status {}", result.getStatus());
            throw new OptimizationFailedException(
                    "Optimization failed: solver status " + result.getStatus(), result.getStatus());
        }

        List<ScheduleEntry> entries = new ArrayList<>();
        for (int c = 0; c < courseCount; c++) {
            int assigned = -1;
            for (int s = 0; s < slotCount; s++) {
                if (result.isSet(x[s][c])) {
                    assigned = s;
                    break;
                }
            }
            if (assigned < 0) {
                throw new SolverFaultException("Solver returned no slot for course " + courses.get(c));
            }
            TimeSlot slot = catalog.get(assigned);
            entries.add(new ScheduleEntry(courses.get(c), slot.getCode(), slot.getLabel(),
                    satisfaction.get(c, assigned)));
        }

        logger.info("Assigned {} courses with total satisfaction {}", courseCount, result.getObjectiveValue());
        return new AssignmentSolution(entries, result.getObjectiveValue(), result.getWallTimeMillis());
    }

    private void addGroupTerms(LinearConstraint row, List<TimeSlot> group, int[][] x, int courseCount) {
        for (TimeSlot slot : group) {
            int s = catalog.indexOf(slot);
            for (int c = 0; c < courseCount; c++) {
                row.addTerm(x[s][c], 1);
            }
        }
    }
}
