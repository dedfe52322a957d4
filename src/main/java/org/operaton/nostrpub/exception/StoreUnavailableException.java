package org.operaton.nostrpub.exception;

/**
 * Exception thrown when the persistent store cannot be reached.
 * Aborts the current operation; callers retry with their own policy.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
