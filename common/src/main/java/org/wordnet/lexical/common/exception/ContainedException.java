package org.wordnet.lexical.common.exception;

/**
 * The operation failed and won't succeed with the same input, but the session
 * is still healthy and other operations may proceed.
 */
public class ContainedException extends RuntimeException {
    public ContainedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainedException(String message) {
        super(message);
    }
}
