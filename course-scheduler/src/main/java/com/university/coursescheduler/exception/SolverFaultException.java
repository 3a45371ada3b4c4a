package com.university.coursescheduler.exception;

/**
 * The optimization backend itself failed (could not be created, rejected the
 * model, or ended abnormally).
 */
public class SolverFaultException extends SchedulingException {

    public SolverFaultException(String message) {
        super(message);
    }

    public SolverFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return "SolverFault";
    }
}
