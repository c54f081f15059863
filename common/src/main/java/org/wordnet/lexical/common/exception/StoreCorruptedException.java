package org.wordnet.lexical.common.exception;

import java.nio.file.Path;

/**
 * The on-disk store failed its integrity checks. Nothing attempts to repair
 * it; remove the store directory and re-add the lexicons.
 */
public class StoreCorruptedException extends FatalException {
    public StoreCorruptedException(Path store, Throwable cause) {
        super("Store " + store + " is corrupted", cause);
    }
}
