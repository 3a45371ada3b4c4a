package com.university.coursescheduler.exception;

import com.university.coursescheduler.solver.SolveStatus;

/**
 * The assignment model was not solved to certified optimality, either because
 * the time budget ran out, the model was infeasible, or the caller aborted the
 * run. No partial schedule accompanies this failure.
 */
public class OptimizationFailedException extends SchedulingException {

    private final SolveStatus status;

    public OptimizationFailedException(String message, SolveStatus status) {
        super(message);
        this.status = status;
    }

    public SolveStatus getStatus() {
        return status;
    }

    @Override
    public String getReason() {
        return status == SolveStatus.ABORTED ? "Aborted" : "InfeasibleOrUnsolved";
    }
}
