package org.wordnet.lexical.store;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.concurrent.ThreadSafe;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexFormatTooNewException;
import org.apache.lucene.index.IndexFormatTooOldException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexWriterConfig.OpenMode;
import org.apache.lucene.index.SerialMergeScheduler;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.LockObtainFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.LexiconConflictException;
import org.wordnet.lexical.common.exception.LexiconNotFoundException;
import org.wordnet.lexical.common.exception.StorageException;
import org.wordnet.lexical.common.exception.StoreCorruptedException;
import org.wordnet.lexical.common.exception.StoreLockedException;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.lmf.LmfDocument;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;

/**
 * Handle on the index of one data directory.
 *
 * <p>Writes are serialized: in this process by a lock, across processes (or
 * across handles on the same directory) by the index write lock. Both are
 * waited for up to the configured lock wait, after which the write fails with
 * {@link StoreLockedException}. Readers are never blocked.
 */
@ThreadSafe
public class LexicalStore implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(LexicalStore.class);

    /**
     * Pause between attempts at the index write lock.
     */
    private static final long LOCK_RETRY_MILLIS = 50;

    private final Path path;
    private final Duration lockWait;
    private final Directory directory;
    private final SearcherManager searcherManager;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile boolean closed;

    private LexicalStore(Path path, Duration lockWait, Directory directory, SearcherManager searcherManager) {
        this.path = path;
        this.lockWait = lockWait;
        this.directory = directory;
        this.searcherManager = searcherManager;
    }

    /**
     * Open the store in {@code path}, creating an empty one if there is none.
     *
     * @throws StoreCorruptedException if the index can't be read
     * @throws StoreLockedException if the store has to be created and another
     *      writer holds it
     */
    public static LexicalStore open(Path path, Duration lockWait) {
        Directory directory = null;
        try {
            Files.createDirectories(path);
            directory = FSDirectory.open(path);
            if (!DirectoryReader.indexExists(directory)) {
                log.info("Creating empty store in {}", path);
                try (IndexWriter writer = openWriter(path, directory, lockWait)) {
                    writer.commit();
                }
            }
            SearcherManager searcherManager = new SearcherManager(directory, null);
            log.debug("Opened store {}", path);
            return new LexicalStore(path, lockWait, directory, searcherManager);
        } catch (IOException | RuntimeException e) {
            closeQuietly(directory, e);
            if (e instanceof IOException) {
                throw failure(path, (IOException) e);
            }
            throw (RuntimeException) e;
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Add the lexicons of a parsed document in one transaction.
     *
     * @param force replace lexicons already installed under the same id
     * @return ids of the added lexicons, in document order
     * @throws LexiconConflictException if a lexicon is installed and
     *      {@code force} isn't set; nothing is written
     */
    public List<String> add(LmfDocument document, boolean force) {
        return add(Collections.singletonList(document), Collections.emptyList(), force);
    }

    /**
     * Add ILI entries and the lexicons of several documents in one
     * transaction. ILI entries are written first so that lexicons referring
     * to them don't presuppose them.
     *
     * @return ids of the added lexicons, in document order
     * @throws LexiconConflictException if a lexicon is installed, or appears
     *      twice, and {@code force} isn't set; nothing is written
     */
    public List<String> add(List<LmfDocument> documents, Collection<IliEntry> ilis, boolean force) {
        return write(writer -> {
            for (IliEntry entry : ilis) {
                writer.putIli(entry);
            }
            List<String> added = new ArrayList<>();
            for (LmfDocument document : documents) {
                for (Lexicon lexicon : document.getLexicons()) {
                    Optional<Lexicon> installed = writer.lexicon(lexicon.getId());
                    if (installed.isPresent()) {
                        if (!force) {
                            throw new LexiconConflictException(lexicon.getId(), installed.get().getVersion());
                        }
                        log.info("Replacing lexicon {} with {}", installed.get().specifier(), lexicon.specifier());
                        writer.deleteLexicon(lexicon.getId());
                    }
                    writer.addLexicon(document, lexicon);
                    added.add(lexicon.getId());
                }
            }
            return added;
        });
    }

    /**
     * Remove a lexicon and everything it owns.
     *
     * @throws LexiconNotFoundException if no lexicon has that id
     */
    public Lexicon remove(String lexiconId) {
        return write(writer -> {
            Lexicon lexicon = writer.lexicon(lexiconId)
                    .orElseThrow(() -> new LexiconNotFoundException(lexiconId));
            writer.deleteLexicon(lexiconId);
            return lexicon;
        });
    }

    /**
     * Insert or replace ILI entries in one transaction.
     */
    public int putIlis(Collection<IliEntry> entries) {
        return write(writer -> {
            for (IliEntry entry : entries) {
                writer.putIli(entry);
            }
            return entries.size();
        });
    }

    /**
     * Run a unit of work in a write transaction. It is committed if it
     * returns and rolled back if it throws.
     */
    public <T> T write(StoreTransaction<T> work) {
        checkOpen();
        acquireWriteLock();
        try {
            IndexWriter writer = openWriter(path, directory, lockWait);
            T result;
            try (StoreReader committed = reader()) {
                result = work.run(new StoreWriter(writer, committed));
                writer.commit();
            } catch (IOException | RuntimeException e) {
                rollback(writer, e);
                if (e instanceof IOException) {
                    throw failure(path, (IOException) e);
                }
                throw (RuntimeException) e;
            }
            writer.close();
            searcherManager.maybeRefreshBlocking();
            return result;
        } catch (IOException e) {
            throw failure(path, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Snapshot of the last commit. Close it when done.
     */
    public StoreReader reader() {
        checkOpen();
        try {
            searcherManager.maybeRefresh();
            return new StoreReader(searcherManager);
        } catch (IOException e) {
            throw failure(path, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            searcherManager.close();
        } finally {
            directory.close();
        }
        log.debug("Closed store {}", path);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Store " + path + " is closed");
        }
    }

    private void acquireWriteLock() {
        try {
            if (!writeLock.tryLock(lockWait.toMillis(), MILLISECONDS)) {
                throw new StoreLockedException(path, "Timed out after " + lockWait + " waiting for a write on " + path);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreLockedException(path, e);
        }
    }

    /**
     * Open an index writer, retrying while another writer holds the index
     * lock.
     */
    private static IndexWriter openWriter(Path path, Directory directory, Duration lockWait) throws IOException {
        Retryer<IndexWriter> retryer = RetryerBuilder.<IndexWriter>newBuilder()
                .retryIfExceptionOfType(LockObtainFailedException.class)
                .withWaitStrategy(WaitStrategies.fixedWait(LOCK_RETRY_MILLIS, MILLISECONDS))
                .withStopStrategy(StopStrategies.stopAfterDelay(lockWait.toMillis(), MILLISECONDS))
                .withRetryListener(new RetryListener() {
                    @Override
                    public <V> void onRetry(Attempt<V> attempt) {
                        if (attempt.hasException()) {
                            log.debug("Store {} is locked, attempt #{}", path, attempt.getAttemptNumber());
                        }
                    }
                })
                .build();
        try {
            return retryer.call(() -> new IndexWriter(directory, writerConfig()));
        } catch (RetryException e) {
            Attempt<?> last = e.getLastFailedAttempt();
            throw new StoreLockedException(path, last.hasException() ? last.getExceptionCause() : e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new StorageException("Unable to open a writer on " + path, e.getCause());
        }
    }

    private static IndexWriterConfig writerConfig() {
        IndexWriterConfig config = new IndexWriterConfig();
        config.setOpenMode(OpenMode.CREATE_OR_APPEND);
        config.setMergeScheduler(new SerialMergeScheduler());
        config.setCommitOnClose(false);
        return config;
    }

    private static void rollback(IndexWriter writer, Exception cause) {
        try {
            writer.rollback();
            log.info("Rolled back write on store after {}", cause.toString());
        } catch (IOException | RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static void closeQuietly(Directory directory, Exception cause) {
        if (directory == null) {
            return;
        }
        try {
            directory.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Map an index failure to the error hierarchy.
     */
    static RuntimeException failure(Path path, IOException e) {
        if (e instanceof LockObtainFailedException) {
            return new StoreLockedException(path, e);
        }
        if (e instanceof CorruptIndexException || e instanceof IndexFormatTooOldException
                || e instanceof IndexFormatTooNewException || e instanceof EOFException) {
            return new StoreCorruptedException(path, e);
        }
        return new StorageException("I/O failure on store " + path, e);
    }
}
