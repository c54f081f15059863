package org.wordnet.lexical.common.exception;

/**
 * The project specifier doesn't resolve to a downloadable resource. Retrying
 * won't help.
 */
public class UnknownProjectException extends ContainedException {
    public UnknownProjectException(String message) {
        super(message);
    }
}
