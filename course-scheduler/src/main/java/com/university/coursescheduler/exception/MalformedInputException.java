package com.university.coursescheduler.exception;

/**
 * A supplied table could not be read into the expected shape.
 * The caller may fix the table and resupply it.
 */
public class MalformedInputException extends SchedulingException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return "MalformedInput";
    }
}
