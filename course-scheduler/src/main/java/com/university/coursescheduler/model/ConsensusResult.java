package com.university.coursescheduler.model;

import java.util.Arrays;

/**
 * Popularity per candidate slot (catalog order, 1 = most popular) and the
 * disagreement score of the consensus order. The score is
 * {@link Double#POSITIVE_INFINITY} when no certified consensus exists.
 */
public class ConsensusResult {

    private final double[] popularity;
    private final double score;
    private final boolean optimal;

    public ConsensusResult(double[] popularity, double score, boolean optimal) {
        this.popularity = popularity.clone();
        this.score = score;
        this.optimal = optimal;
    }

    public static ConsensusResult uniform(int candidateCount, double score) {
        double[] popularity = new double[candidateCount];
        Arrays.fill(popularity, 0.5);
        return new ConsensusResult(popularity, score, true);
    }

    public double[] getPopularity() {
        return popularity.clone();
    }

    public double getPopularity(int candidate) {
        return popularity[candidate];
    }

    public double getScore() {
        return score;
    }

    public boolean isOptimal() {
        return optimal;
    }
}
