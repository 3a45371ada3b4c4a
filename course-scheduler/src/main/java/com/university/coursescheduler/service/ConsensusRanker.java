package com.university.coursescheduler.service;

import com.university.coursescheduler.config.SchedulerProperties;
import com.university.coursescheduler.exception.OptimizationFailedException;
import com.university.coursescheduler.model.ConsensusResult;
import com.university.coursescheduler.model.PreferenceTable;
import com.university.coursescheduler.solver.LinearModel;
import com.university.coursescheduler.solver.MipBackend;
import com.university.coursescheduler.solver.SolveOptions;
import com.university.coursescheduler.solver.SolveResult;
import com.university.coursescheduler.solver.SolveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Kemeny-Young rank aggregation. Each course that ranked at least one slot is a
 * voter, each slot a candidate; the consensus order is the linear order with
 * the fewest pairwise disagreements with all voters, found by integer
 * programming.
 */
@Service
public class ConsensusRanker {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusRanker.class);

    private final MipBackend backend;
    private final SchedulerProperties properties;

    public ConsensusRanker(MipBackend backend, SchedulerProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    /**
     * Popularity of every slot in the table. Courses with no ranked slot do not
     * vote; if no course voted, every slot gets 0.5 and the score is zero.
     */
    public ConsensusResult slotPopularity(PreferenceTable table, SolveOptions options) {
        int[][] voters = table.getVotingRows();
        if (voters.length == 0) {
            logger.info("No course ranked any slot, using neutral popularity");
            return ConsensusResult.uniform(table.getSlotCount(), 0);
        }
        logger.info("Aggregating rankings of {} voters over {} slots", voters.length, table.getSlotCount());
        return aggregate(voters, table.getSlotCount(), options);
    }

    /**
     * Aggregates a voters x candidates rank matrix (0 = unranked).
     */
    public ConsensusResult aggregate(int[][] ranks, int candidateCount, SolveOptions options) {
        if (ranks.length == 0 || candidateCount == 0) {
            return ConsensusResult.uniform(candidateCount, Double.POSITIVE_INFINITY);
        }

        LinearModel model = new LinearModel("KemenyYoung");
        // ahead[i][j] is true when candidate i precedes candidate j
        int[][] ahead = new int[candidateCount][candidateCount];
        for (int i = 0; i < candidateCount; i++) {
            for (int j = 0; j < candidateCount; j++) {
                ahead[i][j] = i == j ? -1 : model.addBoolVar("x_" + i + "_" + j);
            }
        }

        for (int[] voter : ranks) {
            for (int i = 0; i < candidateCount; i++) {
                for (int j = i + 1; j < candidateCount; j++) {
                    if (voter[i] == 0 || voter[j] == 0) {
                        continue;
                    }
                    if (voter[i] < voter[j]) {
                        model.addObjectiveTerm(ahead[j][i], 1);
                    } else if (voter[i] > voter[j]) {
                        model.addObjectiveTerm(ahead[i][j], 1);
                    }
                }
            }
        }

        if (!model.hasObjectiveTerms()) {
            logger.info("No voter separates any two slots, consensus is a full tie");
            return ConsensusResult.uniform(candidateCount, 0);
        }
        model.minimize();

        for (int i = 0; i < candidateCount; i++) {
            for (int j = i + 1; j < candidateCount; j++) {
                model.addEquality(1, "order_" + i + "_" + j)
                        .addTerm(ahead[i][j], 1)
                        .addTerm(ahead[j][i], 1);
            }
        }

        // No 3-cycles. Rotations of a cycle give the same row, so i is the smallest index.
        for (int i = 0; i < candidateCount; i++) {
            for (int j = i + 1; j < candidateCount; j++) {
                for (int k = i + 1; k < candidateCount; k++) {
                    if (j == k) {
                        continue;
                    }
                    model.addAtMost(2, "cycle_" + i + "_" + j + "_" + k)
                            .addTerm(ahead[i][j], 1)
                            .addTerm(ahead[j][k], 1)
                            .addTerm(ahead[k][i], 1);
                }
            }
        }

        SolveResult result = backend.solve(model, options);
        if (result.getStatus() == SolveStatus.ABORTED) {
            throw new OptimizationFailedException("Consensus ranking was aborted", SolveStatus.ABORTED);
        }
        if (!result.isOptimal()) {
            logger.warn("Consensus ranking ended with status {}, falling back to mean ranks", result.getStatus());
            return new ConsensusResult(rescale(meanRanks(ranks, candidateCount)), Double.POSITIVE_INFINITY, false);
        }

        double[] losses = new double[candidateCount];
        for (int i = 0; i < candidateCount; i++) {
            for (int j = 0; j < candidateCount; j++) {
                if (i != j && result.isSet(ahead[i][j])) {
                    losses[j] += 1;
                }
            }
        }
        double score = Math.round(result.getObjectiveValue());
        logger.info("Consensus order found with {} pairwise disagreements", (long) score);
        return new ConsensusResult(rescale(losses), score, true);
    }

    /**
     * Mean of each candidate's non-zero ranks; candidates nobody ranked sit at
     * the middle of the rank scale.
     */
    double[] meanRanks(int[][] ranks, int candidateCount) {
        double midpoint = (1 + properties.getSatisfaction().getMaxRank()) / 2.0;
        double[] means = new double[candidateCount];
        for (int j = 0; j < candidateCount; j++) {
            double sum = 0;
            int count = 0;
            for (int[] voter : ranks) {
                if (voter[j] > 0) {
                    sum += voter[j];
                    count++;
                }
            }
            means[j] = count > 0 ? sum / count : midpoint;
        }
        return means;
    }

    // Lower loss means more popular: the least preceded candidate maps to 1, the most preceded to 0.
    private static double[] rescale(double[] losses) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double loss : losses) {
            max = Math.max(max, loss);
            min = Math.min(min, loss);
        }
        double[] popularity = new double[losses.length];
        for (int i = 0; i < losses.length; i++) {
            popularity[i] = max == min ? 0.5 : (max - losses[i]) / (max - min);
        }
        return popularity;
    }
}
