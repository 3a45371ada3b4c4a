package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.exception.MalformedInputException;
import com.university.coursescheduler.exception.OptimizationFailedException;
import com.university.coursescheduler.model.CourseFaculty;
import com.university.coursescheduler.model.CoursePreference;
import com.university.coursescheduler.model.FacultyMember;
import com.university.coursescheduler.model.ScheduleEntry;
import com.university.coursescheduler.model.ScheduleResult;
import com.university.coursescheduler.model.SchedulingRequest;
import com.university.coursescheduler.solver.MipBackend;
import com.university.coursescheduler.solver.OrToolsMipBackend;
import com.university.coursescheduler.solver.SolveCancellation;
import com.university.coursescheduler.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SchedulingServiceTest {

    private SlotCatalog catalog;
    private SchedulingService service;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        catalog = new SlotCatalog();
        MipBackend backend = new OrToolsMipBackend(properties.getSolver().getBackend());
        service = new SchedulingService(catalog,
                new ConsensusRanker(backend, properties),
                new SatisfactionModel(properties),
                new AssignmentSolver(backend, catalog),
                new StatsReporter(catalog, properties),
                properties);
    }

    @Test
    void zeroCoursesGiveAnEmptyResult() {
        ScheduleResult result = service.optimize(request(Collections.emptyList(), 1L));

        assertThat(result.getEntries()).isEmpty();
        assertThat(result.getSatisfactionTotal()).isZero();
        assertThat(result.getKemenyScore()).isZero();
        assertThat(result.getSlotPopularity()).hasSize(10).containsValue(0.5);
        assertThat(result.getStats().getSlotCounts().values()).containsOnly(0);
    }

    @Test
    void allZeroSelectionsStillProduceABalancedSchedule() {
        List<CoursePreference> selection = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            selection.add(new CoursePreference("HIST " + (100 + i), ranks(0, 0, 0, 0, 0, 0, 0, 0, 0, 0)));
        }

        ScheduleResult result = service.optimize(request(selection, 5L));

        assertThat(result.getSlotPopularity().values()).containsOnly(0.5);
        assertThat(result.getKemenyScore()).isZero();
        assertThat(result.getEntries()).hasSize(10)
                .allSatisfy(e -> assertThat(e.getSatisfaction()).isZero());
        assertThat(result.getStats().getDayPatternCounts().values()).allSatisfy(n -> assertThat(n).isGreaterThanOrEqualTo(4));
        assertThat(result.getStats().getStartTimeCounts().values()).containsOnly(2);
    }

    @Test
    void everyoneWantingTheFirstSlotIsSpreadByBalance() {
        List<CoursePreference> selection = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            selection.add(new CoursePreference("HIST " + (100 + i), ranks(1, 0, 0, 0, 0, 0, 0, 0, 0, 0)));
        }

        ScheduleResult result = service.optimize(request(selection, 11L));

        // Nobody compares two slots, so every slot ties at the neutral popularity.
        assertThat(result.getSlotPopularity().get("s1")).isEqualTo(0.5);
        List<ScheduleEntry> onFirst = new ArrayList<>();
        for (ScheduleEntry entry : result.getEntries()) {
            if (entry.getSlot().equals("s1")) {
                onFirst.add(entry);
            } else {
                assertThat(entry.getSatisfaction()).isZero();
            }
        }
        assertThat(onFirst).hasSize(2)
                .allSatisfy(e -> assertThat(e.getSatisfaction()).isBetween(3.6, 4.5));
        assertThat(result.getSatisfactionTotal())
                .isCloseTo(onFirst.get(0).getSatisfaction() + onFirst.get(1).getSatisfaction(), within(1e-6));
    }

    @Test
    void contestedPreferencesYieldSpreadPopularity() {
        List<CoursePreference> selection = new ArrayList<>();
        selection.add(new CoursePreference("A", ranks(1, 2, 3, 4, 0, 0, 0, 0, 0, 0)));
        selection.add(new CoursePreference("B", ranks(1, 3, 2, 4, 0, 0, 0, 0, 0, 0)));
        selection.add(new CoursePreference("C", ranks(2, 1, 0, 0, 3, 4, 0, 0, 0, 0)));
        selection.add(new CoursePreference("D", ranks(0, 0, 0, 0, 0, 0, 1, 2, 3, 4)));

        ScheduleResult result = service.optimize(request(selection, 3L));

        // s1/s2 and s2/s3 are contested once each; every other pair can follow all voters.
        assertThat(result.getKemenyScore()).isEqualTo(2.0);
        assertThat(result.getSlotPopularity().get("s1")).isGreaterThan(result.getSlotPopularity().get("s2"));
        assertThat(result.getSlotPopularity().get("s1")).isGreaterThan(result.getSlotPopularity().get("s4"));
        assertThat(result.getSlotPopularity().get("s7")).isGreaterThan(result.getSlotPopularity().get("s10"));
        assertThat(result.getSlotPopularity().values()).contains(0.0, 1.0);
        assertThat(result.getEntries()).extracting(ScheduleEntry::getCourse).containsExactly("A", "B", "C", "D");
    }

    @Test
    void sameSeedSameSchedule() {
        List<CoursePreference> selection = randomSelection(new Random(99), 12);

        ScheduleResult first = service.optimize(request(selection, 1234L));
        ScheduleResult second = service.optimize(request(selection, 1234L));

        assertThat(second.getEntries()).extracting(ScheduleEntry::getSlot)
                .containsExactlyElementsOf(first.getEntries().stream().map(ScheduleEntry::getSlot).toList());
        assertThat(second.getSatisfactionTotal()).isEqualTo(first.getSatisfactionTotal());
        assertThat(second.getSlotPopularity()).isEqualTo(first.getSlotPopularity());
    }

    @Test
    void votingFacultyCoursesAvoidTheMeetingSlot() {
        List<CoursePreference> selection = new ArrayList<>();
        List<CourseFaculty> courses = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String course = "HIST " + (200 + i);
            selection.add(new CoursePreference(course, ranks(0, 0, 0, 0, 0, 0, 0, 0, 2, 1)));
            courses.add(new CourseFaculty(course, i < 6 ? "Ada" : "Grace"));
        }
        SchedulingRequest request = request(selection, 8L);
        request.setCourses(courses);
        request.setFaculty(List.of(new FacultyMember("Ada", 0.0, true), new FacultyMember("Grace", 1.0, false)));

        ScheduleResult result = service.optimize(request);

        assertThat(result.getEntries()).filteredOn(e -> e.getSlot().equals("s9") || e.getSlot().equals("s10"))
                .hasSize(2);
        assertThat(result.getEntries()).filteredOn(e -> e.getSlot().equals("s10"))
                .allSatisfy(e -> assertThat(Set.of("HIST 206", "HIST 207", "HIST 208", "HIST 209"))
                        .contains(e.getCourse()));
    }

    @Test
    void votingCoursesNeedAMappedRosterMember() {
        List<String> courses = List.of("A", "B", "C");
        List<CourseFaculty> mapping = List.of(new CourseFaculty("A", "Ada"), new CourseFaculty("B", "Nobody"));
        List<FacultyMember> faculty = List.of(new FacultyMember("Ada", 0.0, true));

        assertThat(service.votingCourses(courses, mapping, faculty)).containsExactly(0);
    }

    @Test
    void cancelledRunFailsWithoutASchedule() {
        List<CoursePreference> selection = randomSelection(new Random(4), 6);
        SolveCancellation cancellation = new SolveCancellation();
        cancellation.cancel();

        assertThatThrownBy(() -> service.optimize(request(selection, 1L), cancellation))
                .isInstanceOf(OptimizationFailedException.class)
                .extracting("status").isEqualTo(SolveStatus.ABORTED);
    }

    @Test
    void missingTablesAreMalformedInput() {
        SchedulingRequest request = request(Collections.emptyList(), 1L);
        request.setFaculty(null);

        assertThatThrownBy(() -> service.optimize(request)).isInstanceOf(MalformedInputException.class);
    }

    private static SchedulingRequest request(List<CoursePreference> selection, Long seed) {
        return new SchedulingRequest(Collections.emptyList(), Collections.emptyList(), selection, seed);
    }

    private static List<Integer> ranks(Integer... values) {
        return Arrays.asList(values);
    }

    private static List<CoursePreference> randomSelection(Random random, int courseCount) {
        List<CoursePreference> selection = new ArrayList<>();
        for (int i = 0; i < courseCount; i++) {
            List<Integer> slots = new ArrayList<>();
            for (int s = 0; s < 10; s++) {
                slots.add(s);
            }
            Collections.shuffle(slots, random);
            Integer[] row = new Integer[10];
            Arrays.fill(row, 0);
            for (int r = 0; r < 4; r++) {
                row[slots.get(r)] = r + 1;
            }
            selection.add(new CoursePreference("C" + i, Arrays.asList(row)));
        }
        return selection;
    }
}
