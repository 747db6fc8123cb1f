package io.downloader4j.core;

/**
 * A submitted job payload does not satisfy the job contract. Never retried.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
