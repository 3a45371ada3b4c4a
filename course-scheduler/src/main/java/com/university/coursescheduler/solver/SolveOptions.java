package com.university.coursescheduler.solver;

import java.time.Duration;

/**
 * Per-solve budget and cancellation handle. A null time limit leaves the
 * backend unbounded.
 */
public class SolveOptions {

    private final Duration timeLimit;
    private final SolveCancellation cancellation;

    public SolveOptions(Duration timeLimit, SolveCancellation cancellation) {
        this.timeLimit = timeLimit;
        this.cancellation = cancellation != null ? cancellation : SolveCancellation.none();
    }

    public static SolveOptions withTimeLimit(Duration timeLimit) {
        return new SolveOptions(timeLimit, SolveCancellation.none());
    }

    public Duration getTimeLimit() {
        return timeLimit;
    }

    public SolveCancellation getCancellation() {
        return cancellation;
    }
}
