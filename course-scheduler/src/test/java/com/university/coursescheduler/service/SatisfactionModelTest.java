package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.model.CoursePreference;
import com.university.coursescheduler.model.PreferenceTable;
import com.university.coursescheduler.model.SatisfactionMatrix;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SatisfactionModelTest {

    private final SatisfactionModel model = new SatisfactionModel(new SchedulerProperties());

    @Test
    void unrankedSlotScoresZeroWhateverThePopularity() {
        Random random = new Random(1);
        for (double popularity : new double[]{0.0, 0.5, 1.0}) {
            assertThat(model.satisfaction(0, popularity, random)).isEqualTo(0.0);
        }
    }

    @Test
    void rankedSlotScoreStaysWithinNoiseBand() {
        Random random = new Random(3);
        for (int i = 0; i < 200; i++) {
            double value = model.satisfaction(1, 0.25, random);
            // (5 - 1) - 0.25 plus noise in [0.1, 1.0)
            assertThat(value).isGreaterThanOrEqualTo(3.85).isLessThan(4.75);
        }
    }

    @Test
    void neverNegative() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getSatisfaction().setNoiseMin(0.0);
        properties.getSatisfaction().setNoiseMax(0.01);
        SatisfactionModel lowNoise = new SatisfactionModel(properties);

        assertThat(lowNoise.satisfaction(5, 1.0, new Random(9))).isEqualTo(0.0);
        assertThat(lowNoise.satisfaction(9, 0.0, new Random(9))).isEqualTo(0.0);
    }

    @Test
    void preferredSlotOutscoresLessPreferredSlot() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getSatisfaction().setNoiseMin(0.1);
        properties.getSatisfaction().setNoiseMax(0.2);
        SatisfactionModel narrowNoise = new SatisfactionModel(properties);
        Random random = new Random(11);

        assertThat(narrowNoise.satisfaction(1, 0.5, random)).isGreaterThan(narrowNoise.satisfaction(2, 0.5, random));
    }

    @Test
    void sameSeedReproducesTheMatrix() {
        PreferenceTable table = PreferenceTable.of(List.of(
                new CoursePreference("A", Arrays.asList(1, 2, 0, 3)),
                new CoursePreference("B", Arrays.asList(0, 1, 1, 0)),
                new CoursePreference("C", Arrays.asList(4, 0, 2, 1))), 4);
        double[] popularity = {1.0, 0.5, 0.25, 0.0};

        SatisfactionMatrix first = model.matrix(table, popularity, new Random(42));
        SatisfactionMatrix second = model.matrix(table, popularity, new Random(42));

        for (int c = 0; c < table.getCourseCount(); c++) {
            for (int s = 0; s < table.getSlotCount(); s++) {
                assertThat(first.get(c, s)).isEqualTo(second.get(c, s));
                if (table.getRank(c, s) == 0) {
                    assertThat(first.get(c, s)).isEqualTo(0.0);
                } else {
                    assertThat(first.get(c, s)).isPositive();
                }
            }
        }
    }
}
