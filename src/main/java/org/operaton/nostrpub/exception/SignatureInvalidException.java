package org.operaton.nostrpub.exception;

/**
 * Exception thrown when an inbound activity fails HTTP signature verification.
 * The activity is rejected without any side effects.
 */
public class SignatureInvalidException extends RuntimeException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
