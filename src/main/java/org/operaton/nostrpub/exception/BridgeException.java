package org.operaton.nostrpub.exception;

/**
 * Base exception for malformed or unsupported input crossing the bridge.
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
