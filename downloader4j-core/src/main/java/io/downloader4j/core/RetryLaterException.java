package io.downloader4j.core;

/**
 * The queue exists but cannot be consumed right now. Callers should back off and try again.
 */
public class RetryLaterException extends JobStoreException {

    public RetryLaterException(String message) {
        super(message);
    }

    public RetryLaterException(String message, Throwable cause) {
        super(message, cause);
    }
}
