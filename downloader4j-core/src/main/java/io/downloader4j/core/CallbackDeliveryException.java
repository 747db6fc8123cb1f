package io.downloader4j.core;

/**
 * A single callback attempt did not reach a 2xx response, or the job was not eligible for one.
 */
public class CallbackDeliveryException extends Exception {

    public CallbackDeliveryException(String message) {
        super(message);
    }

    public CallbackDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
