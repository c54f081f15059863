package org.wordnet.lexical.common.exception;

/**
 * The operation failed but the caller may retry it.
 */
public class RetryableException extends Exception {
    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RetryableException(String message) {
        super(message);
    }
}
