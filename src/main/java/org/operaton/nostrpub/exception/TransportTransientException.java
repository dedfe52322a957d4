package org.operaton.nostrpub.exception;

/**
 * Exception thrown on relay or HTTP I/O failures that are expected to go away on retry.
 */
public class TransportTransientException extends RuntimeException {

    public TransportTransientException(String message) {
        super(message);
    }

    public TransportTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
