package com.university.coursescheduler.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.university.coursescheduler.exception.SolverFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link MipBackend} on top of the OR-Tools linear solver wrapper. Every call
 * creates its own {@link MPSolver} and releases it before returning.
 */
public class OrToolsMipBackend implements MipBackend {

    private static final Logger logger = LoggerFactory.getLogger(OrToolsMipBackend.class);

    private final String solverId;

    public OrToolsMipBackend(String solverId) {
        Loader.loadNativeLibraries();
        this.solverId = solverId;
    }

    @Override
    public SolveResult solve(LinearModel model, SolveOptions options) {
        SolveCancellation cancellation = options.getCancellation();
        if (cancellation.isCancelled()) {
            logger.info("Model {} not solved: run was cancelled", model.getName());
            return SolveResult.withoutSolution(SolveStatus.ABORTED, 0);
        }

        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            throw new SolverFaultException("Could not create solver " + solverId);
        }
        try {
            MPVariable[] variables = new MPVariable[model.getVariableCount()];
            for (int i = 0; i < variables.length; i++) {
                variables[i] = solver.makeBoolVar(model.getVariableName(i));
            }

            for (LinearConstraint row : model.getConstraints()) {
                MPConstraint constraint = solver.makeConstraint(
                        toSolverBound(row.getLowerBound()), toSolverBound(row.getUpperBound()), row.getName());
                for (Map.Entry<Integer, Double> term : row.getCoefficients().entrySet()) {
                    constraint.setCoefficient(variables[term.getKey()], term.getValue());
                }
            }

            MPObjective objective = solver.objective();
            for (Map.Entry<Integer, Double> term : model.getObjective().entrySet()) {
                objective.setCoefficient(variables[term.getKey()], term.getValue());
            }
            if (model.isMaximize()) {
                objective.setMaximization();
            } else {
                objective.setMinimization();
            }

            if (options.getTimeLimit() != null) {
                solver.setTimeLimit(options.getTimeLimit().toMillis());
            }

            logger.info("Solving {} with {}: {} variables, {} constraints",
                    model.getName(), solverId, variables.length, model.getConstraints().size());

            MPSolver.ResultStatus resultStatus;
            cancellation.attach(solver::interruptSolve);
            try {
                resultStatus = solver.solve();
            } finally {
                cancellation.detach();
            }
            long wallTime = solver.wallTime();

            if (cancellation.isCancelled()) {
                logger.warn("Solve of {} was interrupted after {} ms", model.getName(), wallTime);
                return SolveResult.withoutSolution(SolveStatus.ABORTED, wallTime);
            }

            SolveStatus status = translate(resultStatus, model.getName());
            logger.info("Solver finished {} with status {} in {} ms", model.getName(), status, wallTime);
            if (status != SolveStatus.OPTIMAL && status != SolveStatus.FEASIBLE) {
                return SolveResult.withoutSolution(status, wallTime);
            }

            double[] values = new double[variables.length];
            for (int i = 0; i < variables.length; i++) {
                values[i] = variables[i].solutionValue();
            }
            return new SolveResult(status, values, objective.value(), wallTime);
        } finally {
            solver.delete();
        }
    }

    private static double toSolverBound(double bound) {
        if (bound == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (bound == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return bound;
    }

    private static SolveStatus translate(MPSolver.ResultStatus resultStatus, String modelName) {
        switch (resultStatus) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case UNBOUNDED:
                return SolveStatus.UNBOUNDED;
            case NOT_SOLVED:
                return SolveStatus.NOT_SOLVED;
            default:
                logger.error("Solver reported {} for model {}", resultStatus, modelName);
                throw new SolverFaultException("Solver reported " + resultStatus + " for model " + modelName);
        }
    }
}
