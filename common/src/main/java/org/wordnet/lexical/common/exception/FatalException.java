package org.wordnet.lexical.common.exception;

/**
 * The operation failed and the session is likely unusable until someone
 * fixes the environment (configuration, data directory, corrupted store).
 * Never retried automatically.
 */
public class FatalException extends RuntimeException {
    public FatalException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalException(String message) {
        super(message);
    }
}
