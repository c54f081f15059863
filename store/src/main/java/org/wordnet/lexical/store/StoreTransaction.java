package org.wordnet.lexical.store;

import java.io.IOException;

/**
 * Unit of work run inside one write transaction. Everything it writes becomes
 * visible at once when it returns, and nothing does if it throws.
 */
@FunctionalInterface
public interface StoreTransaction<T> {
    T run(StoreWriter writer) throws IOException;
}
