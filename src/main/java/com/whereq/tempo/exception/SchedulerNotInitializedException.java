package com.whereq.tempo.exception;

/**
 * Exception thrown when the scheduler engine or job store is not ready to
 * accept the requested operation
 */
public class SchedulerNotInitializedException extends RuntimeException {
    public SchedulerNotInitializedException(String message) {
        super(message);
    }

    public SchedulerNotInitializedException(String message, Throwable cause) {
        super(message, cause);
    }
}
