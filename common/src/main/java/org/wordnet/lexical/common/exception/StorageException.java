package org.wordnet.lexical.common.exception;

/**
 * The store could not be read or written. Any write in progress has been
 * rolled back.
 */
public class StorageException extends ContainedException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
