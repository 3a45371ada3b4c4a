package com.university.coursescheduler.exception;

/**
 * Base type for every failure the scheduling pipeline reports to its caller.
 * Each subtype carries a stable reason code that the HTTP layer echoes back.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }

    protected SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getReason();
}
