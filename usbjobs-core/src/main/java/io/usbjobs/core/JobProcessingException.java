package io.usbjobs.core;

/**
 * Raised by a job processor when the job content cannot be produced.
 * The worker turns it into a retry or a terminal failure depending on the attempt count.
 */
public class JobProcessingException extends RuntimeException {

    private final String errorCode;

    public JobProcessingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JobProcessingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
