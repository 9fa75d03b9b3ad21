package com.whereq.tempo.exception;

/**
 * Exception thrown when the durable job store cannot complete an operation
 */
public class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
