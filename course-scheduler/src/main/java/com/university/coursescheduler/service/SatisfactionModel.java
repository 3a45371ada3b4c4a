package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.model.PreferenceTable;
import com.university.coursescheduler.model.SatisfactionMatrix;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Scores a (course, slot) pair: strongly preferred slots score high, popular
 * slots are discounted to spread demand, and a small random amount breaks ties
 * between otherwise equal schedules.
 */
@Component
public class SatisfactionModel {

    private final SchedulerProperties properties;

    public SatisfactionModel(SchedulerProperties properties) {
        this.properties = properties;
    }

    /**
     * Satisfaction for one pair. An unranked slot scores exactly 0 and draws no
     * noise.
     */
    public double satisfaction(int rank, double popularity, Random random) {
        if (rank == 0) {
            return 0;
        }
        SchedulerProperties.Satisfaction config = properties.getSatisfaction();
        int scale = config.getMaxRank() + 1;
        double noise = config.getNoiseMin() + random.nextDouble() * (config.getNoiseMax() - config.getNoiseMin());
        return Math.max(0, (scale - rank) - popularity + noise);
    }

    /**
     * Builds the course x slot matrix. Noise is drawn slot by slot, course by
     * course, so a given seed always reproduces the same matrix.
     */
    public SatisfactionMatrix matrix(PreferenceTable table, double[] popularity, Random random) {
        SatisfactionMatrix matrix = new SatisfactionMatrix(table.getCourseCount(), table.getSlotCount());
        for (int s = 0; s < table.getSlotCount(); s++) {
            for (int c = 0; c < table.getCourseCount(); c++) {
                matrix.set(c, s, satisfaction(table.getRank(c, s), popularity[s], random));
            }
        }
        return matrix;
    }
}
