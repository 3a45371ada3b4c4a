package com.university.coursescheduler.solver;

/**
 * Integer-programming capability the scheduling pipeline depends on. Model
 * building code only talks to this interface, so the engine behind it can be
 * swapped without touching the consensus or assignment logic.
 */
public interface MipBackend {

    /**
     * Solves the model within the given budget. Statuses the pipeline can act
     * on (optimal, feasible, infeasible, not solved, aborted) come back as a
     * {@link SolveResult}; a backend that breaks down throws
     * {@link com.university.coursescheduler.exception.SolverFaultException}.
     */
    SolveResult solve(LinearModel model, SolveOptions options);
}
