package org.wordnet.lexical.common.exception;

import java.nio.file.Path;

/**
 * Another writer (usually another process sharing the data directory) holds
 * the store's write lock. The lock is never broken automatically: wait for
 * the other writer to finish or stop it.
 */
public class StoreLockedException extends StorageException {
    private final Path store;

    public StoreLockedException(Path store, Throwable cause) {
        super("Store " + store + " is locked by another writer", cause);
        this.store = store;
    }

    public StoreLockedException(Path store, String message) {
        super(message);
        this.store = store;
    }

    public Path getStore() {
        return store;
    }
}
