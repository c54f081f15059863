package org.wordnet.lexical.common.exception;

/**
 * An archive can't be extracted, holds an entry escaping the extraction
 * directory, or has no payload.
 */
public class ArchiveException extends ContainedException {
    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
