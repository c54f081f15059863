package org.wordnet.lexical.tool;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.ConfigurationException;
import org.wordnet.lexical.lmf.LmfParsers;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.store.query.LexiconFilter;
import org.wordnet.lexical.store.query.Wordnet;
import org.wordnet.lexical.tool.archive.ArchiveExtractor;
import org.wordnet.lexical.tool.download.Downloader;
import org.wordnet.lexical.tool.download.HttpClientUtils;
import org.wordnet.lexical.tool.export.Exporter;

import com.codahale.metrics.MetricRegistry;

/**
 * Everything bound to one data directory: its store, its project index and
 * the pipeline feeding them. Sessions share no state, several may be open
 * in one process on different directories. Two sessions on the same
 * directory may both read, writes are serialized by the store's lock.
 */
@ThreadSafe
public class WordnetSession implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(WordnetSession.class);

    private final WordnetConfig config;
    private final LexicalStore store;
    private final ProjectIndex projects;
    private final MetricRegistry metricRegistry;
    private final Downloader downloader;
    private final Ingestion ingestion;

    private WordnetSession(WordnetConfig config, LexicalStore store, ProjectIndex projects,
                           MetricRegistry metricRegistry, Downloader downloader, Ingestion ingestion) {
        this.config = config;
        this.store = store;
        this.projects = projects;
        this.metricRegistry = metricRegistry;
        this.downloader = downloader;
        this.ingestion = ingestion;
    }

    /**
     * Open a session, creating the data directory and an empty store when
     * needed.
     *
     * @throws ConfigurationException if the data directory isn't usable or
     *      the project index can't be read
     */
    public static WordnetSession open(WordnetConfig config) {
        Path dataDirectory = config.getDataDirectory();
        if (Files.exists(dataDirectory) && !Files.isDirectory(dataDirectory)) {
            throw new ConfigurationException("Data directory " + dataDirectory + " exists and is not a directory");
        }
        try {
            Files.createDirectories(dataDirectory);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to create data directory " + dataDirectory, e);
        }
        if (!Files.isWritable(dataDirectory)) {
            throw new ConfigurationException("Data directory " + dataDirectory + " is not writable");
        }

        ProjectIndex projects = ProjectIndex.load(config.userIndex());
        LexicalStore store = LexicalStore.open(config.storeDirectory(), config.getWriteLockTimeout());
        return open(config, projects, store);
    }

    /**
     * Wire a session around an open store. The session owns the store from
     * here on: it is closed when wiring fails.
     */
    static WordnetSession open(WordnetConfig config, ProjectIndex projects, LexicalStore store) {
        Downloader downloader = null;
        try {
            MetricRegistry metricRegistry = new MetricRegistry();
            IngestionMetrics metrics = new IngestionMetrics(metricRegistry);
            downloader = new Downloader(
                    HttpClientUtils.createHttpClient(config.getDownloadTimeout(), config.getUserAgent()),
                    config.downloadDirectory(), config.getDownloadTimeout(), metrics);
            Ingestion ingestion = new Ingestion(config, store, projects, downloader,
                    new ArchiveExtractor(config.extractDirectory(), config.getPayloadSuffixes()),
                    LmfParsers.forStrategy(config.getParserStrategy(), config.getDomThreshold()),
                    new Exporter(store, Clock.systemUTC()),
                    metrics);
            log.info("Opened session on {} with {} parsing", config.getDataDirectory(), config.getParserStrategy());
            return new WordnetSession(config, store, projects, metricRegistry, downloader, ingestion);
        } catch (RuntimeException e) {
            closeAfterFailure(downloader, e);
            closeAfterFailure(store, e);
            throw e;
        }
    }

    private static void closeAfterFailure(@Nullable Closeable closeable, RuntimeException failure) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Open a session on a directory with the default configuration.
     */
    public static WordnetSession open(Path dataDirectory) {
        return open(WordnetConfig.forDirectory(dataDirectory));
    }

    public WordnetConfig getConfig() {
        return config;
    }

    public LexicalStore getStore() {
        return store;
    }

    public ProjectIndex getProjects() {
        return projects;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    public Ingestion ingestion() {
        return ingestion;
    }

    /**
     * Query every installed lexicon.
     */
    public Wordnet wordnet() {
        return wordnet(LexiconFilter.ALL);
    }

    /**
     * Query the lexicons matching a space separated list of {@code id} or
     * {@code id:version} specifiers, {@code *} for all.
     */
    public Wordnet wordnet(String lexicons) {
        return wordnet(LexiconFilter.parse(lexicons));
    }

    public Wordnet wordnet(LexiconFilter filter) {
        return new Wordnet(store, filter, config.isLemmatize());
    }

    @Override
    public void close() throws IOException {
        try {
            downloader.close();
        } finally {
            store.close();
        }
        log.debug("Closed session on {}", config.getDataDirectory());
    }
}
