package com.university.coursescheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Default seed for satisfaction noise. Unset means a fresh random source for
     * every request that does not bring its own seed.
     */
    private Long seed;

    /**
     * Largest day-pattern or start-time difference still reported as balanced.
     */
    @Min(0)
    private int balanceReportLimit = 2;

    @Valid
    private final Solver solver = new Solver();

    @Valid
    private final Satisfaction satisfaction = new Satisfaction();

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public int getBalanceReportLimit() {
        return balanceReportLimit;
    }

    public void setBalanceReportLimit(int balanceReportLimit) {
        this.balanceReportLimit = balanceReportLimit;
    }

    public Solver getSolver() {
        return solver;
    }

    public Satisfaction getSatisfaction() {
        return satisfaction;
    }

    public static class Solver {
        // OR-Tools solver id passed to MPSolver.createSolver
        @NotBlank
        private String backend = "SCIP";
        @NotNull
        private Duration consensusTimeLimit = Duration.ofSeconds(30);
        @NotNull
        private Duration assignmentTimeLimit = Duration.ofSeconds(60);

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public Duration getConsensusTimeLimit() {
            return consensusTimeLimit;
        }

        public void setConsensusTimeLimit(Duration consensusTimeLimit) {
            this.consensusTimeLimit = consensusTimeLimit;
        }

        public Duration getAssignmentTimeLimit() {
            return assignmentTimeLimit;
        }

        public void setAssignmentTimeLimit(Duration assignmentTimeLimit) {
            this.assignmentTimeLimit = assignmentTimeLimit;
        }
    }

    public static class Satisfaction {
        @Min(1)
        private int maxRank = 4;
        @DecimalMin("0.0")
        private double noiseMin = 0.1;
        private double noiseMax = 1.0;

        public int getMaxRank() {
            return maxRank;
        }

        public void setMaxRank(int maxRank) {
            this.maxRank = maxRank;
        }

        public double getNoiseMin() {
            return noiseMin;
        }

        public void setNoiseMin(double noiseMin) {
            this.noiseMin = noiseMin;
        }

        public double getNoiseMax() {
            return noiseMax;
        }

        public void setNoiseMax(double noiseMax) {
            this.noiseMax = noiseMax;
        }

        @AssertTrue(message = "noise-min must not exceed noise-max")
        public boolean isNoiseRangeOrdered() {
            return noiseMin <= noiseMax;
        }
    }
}
