package org.wordnet.lexical.tool;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Metrics of the ingestion pipeline, registered in the session's registry.
 */
public class IngestionMetrics {
    /** Time spent parsing LMF and ILI files. */
    private final Timer parseTime;
    /** Time spent in store transactions, commit included. */
    private final Timer commitTime;
    private final Meter downloadedBytes;
    private final Counter addedLexicons;
    private final Counter removedLexicons;
    private final Counter loadedIlis;

    public IngestionMetrics(MetricRegistry metricRegistry) {
        this.parseTime = metricRegistry.timer("ingestion-parse-time");
        this.commitTime = metricRegistry.timer("ingestion-commit-time");
        this.downloadedBytes = metricRegistry.meter("download-bytes");
        this.addedLexicons = metricRegistry.counter("lexicons-added");
        this.removedLexicons = metricRegistry.counter("lexicons-removed");
        this.loadedIlis = metricRegistry.counter("ilis-loaded");
    }

    public Timer.Context timeParse() {
        return parseTime.time();
    }

    public Timer.Context timeCommit() {
        return commitTime.time();
    }

    public void downloaded(long bytes) {
        downloadedBytes.mark(bytes);
    }

    public void added(int lexicons) {
        addedLexicons.inc(lexicons);
    }

    public void removed() {
        removedLexicons.inc();
    }

    public void ilisLoaded(int count) {
        loadedIlis.inc(count);
    }
}
