package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.exception.MalformedInputException;
import com.university.coursescheduler.model.AssignmentSolution;
import com.university.coursescheduler.model.ConsensusResult;
import com.university.coursescheduler.model.CourseFaculty;
import com.university.coursescheduler.model.FacultyMember;
import com.university.coursescheduler.model.PreferenceTable;
import com.university.coursescheduler.model.SatisfactionMatrix;
import com.university.coursescheduler.model.ScheduleResult;
import com.university.coursescheduler.model.ScheduleStats;
import com.university.coursescheduler.model.SchedulingRequest;
import com.university.coursescheduler.solver.SolveCancellation;
import com.university.coursescheduler.solver.SolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Runs one optimization: consensus ranking, satisfaction scoring, assignment
 * and statistics, strictly in that order and only from the given request.
 */
@Service
public class SchedulingService {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingService.class);

    private final SlotCatalog catalog;
    private final ConsensusRanker consensusRanker;
    private final SatisfactionModel satisfactionModel;
    private final AssignmentSolver assignmentSolver;
    private final StatsReporter statsReporter;
    private final SchedulerProperties properties;

    public SchedulingService(SlotCatalog catalog, ConsensusRanker consensusRanker,
            SatisfactionModel satisfactionModel, AssignmentSolver assignmentSolver,
            StatsReporter statsReporter, SchedulerProperties properties) {
        this.catalog = catalog;
        this.consensusRanker = consensusRanker;
        this.satisfactionModel = satisfactionModel;
        this.assignmentSolver = assignmentSolver;
        this.statsReporter = statsReporter;
        this.properties = properties;
    }

    public ScheduleResult optimize(SchedulingRequest request) {
        return optimize(request, SolveCancellation.none());
    }

    /**
     * Same as {@link #optimize(SchedulingRequest)}, abortable through
     * {@code cancellation} from another thread.
     */
    public ScheduleResult optimize(SchedulingRequest request, SolveCancellation cancellation) {
        if (request.getFaculty() == null) {
            throw new MalformedInputException("Faculty data is required");
        }
        if (request.getCourses() == null) {
            throw new MalformedInputException("Course data is required");
        }
        PreferenceTable table = PreferenceTable.of(request.getSelection(), catalog.size());

        if (table.getCourseCount() == 0) {
            logger.warn("No courses found for scheduling!");
            ConsensusResult neutral = ConsensusResult.uniform(catalog.size(), 0);
            return new ScheduleResult(Collections.emptyList(), 0, neutral.getScore(),
                    popularityBySlot(neutral), 0, statsReporter.report(Collections.emptyList()));
        }
        logger.info("Scheduling {} courses over {} slots", table.getCourseCount(), catalog.size());

        SolveOptions consensusOptions = new SolveOptions(
                limit(request.getConsensusTimeLimitMillis(), properties.getSolver().getConsensusTimeLimit()),
                cancellation);
        ConsensusResult consensus = consensusRanker.slotPopularity(table, consensusOptions);

        Random random = noiseSource(request.getSeed());
        SatisfactionMatrix matrix = satisfactionModel.matrix(table, consensus.getPopularity(), random);

        Set<Integer> votingCourses = votingCourses(table.getCourses(), request.getCourses(), request.getFaculty());

        SolveOptions assignmentOptions = new SolveOptions(
                limit(request.getAssignmentTimeLimitMillis(), properties.getSolver().getAssignmentTimeLimit()),
                cancellation);
        AssignmentSolution solution = assignmentSolver.solve(table.getCourses(), matrix, votingCourses,
                assignmentOptions);

        ScheduleStats stats = statsReporter.report(solution.getEntries());
        logger.info("Schedule ready: satisfaction {}, day balance diff {}, start time diff {}",
                solution.getSatisfactionTotal(), stats.getBalanceDiff(), stats.getTimeDiff());

        return new ScheduleResult(solution.getEntries(), solution.getSatisfactionTotal(), consensus.getScore(),
                popularityBySlot(consensus), solution.getSolveTimeMillis(), stats);
    }

    /**
     * Rows of courses whose faculty is flagged as voting. Courses without a
     * faculty mapping, or mapped to someone absent from the roster, are not
     * voting courses.
     */
    Set<Integer> votingCourses(List<String> courses, List<CourseFaculty> courseFaculty,
            List<FacultyMember> faculty) {
        Set<String> votingFaculty = new HashSet<>();
        for (FacultyMember member : faculty) {
            if (member.isVoting() && member.getName() != null) {
                votingFaculty.add(member.getName().trim());
            }
        }
        Map<String, String> facultyByCourse = new HashMap<>();
        for (CourseFaculty row : courseFaculty) {
            if (row.getCourse() != null && row.getFaculty() != null) {
                facultyByCourse.putIfAbsent(row.getCourse().trim(), row.getFaculty().trim());
            }
        }

        Set<Integer> voting = new HashSet<>();
        for (int i = 0; i < courses.size(); i++) {
            String instructor = facultyByCourse.get(courses.get(i));
            if (instructor != null && votingFaculty.contains(instructor)) {
                voting.add(i);
            }
        }
        return voting;
    }

    private Random noiseSource(Long requestSeed) {
        Long seed = requestSeed != null ? requestSeed : properties.getSeed();
        if (seed == null) {
            return new Random();
        }
        logger.info("Using noise seed {}", seed);
        return new Random(seed);
    }

    private static Duration limit(Long overrideMillis, Duration configured) {
        return overrideMillis != null ? Duration.ofMillis(overrideMillis) : configured;
    }

    private Map<String, Double> popularityBySlot(ConsensusResult consensus) {
        Map<String, Double> popularity = new LinkedHashMap<>();
        for (int s = 0; s < catalog.size(); s++) {
            popularity.put(catalog.get(s).getCode(), consensus.getPopularity(s));
        }
        return popularity;
    }
}
