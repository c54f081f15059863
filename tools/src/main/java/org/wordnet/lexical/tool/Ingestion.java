package org.wordnet.lexical.tool;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleConsumer;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.ArchiveException;
import org.wordnet.lexical.common.exception.DownloadException;
import org.wordnet.lexical.common.exception.LexiconConflictException;
import org.wordnet.lexical.common.exception.LexiconNotFoundException;
import org.wordnet.lexical.common.exception.LmfParseException;
import org.wordnet.lexical.common.exception.UnknownProjectException;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.lmf.LmfDocument;
import org.wordnet.lexical.lmf.LmfParser;
import org.wordnet.lexical.lmf.ParseOptions;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.tool.archive.ArchiveExtractor;
import org.wordnet.lexical.tool.download.DownloadOptions;
import org.wordnet.lexical.tool.download.Downloader;
import org.wordnet.lexical.tool.export.ExportOptions;
import org.wordnet.lexical.tool.export.Exporter;

import com.codahale.metrics.Timer;

/**
 * Gets resources into the store and back out.
 *
 * <p>Sources are parsed completely before the store is touched, then
 * written in a single transaction: a malformed source or a conflicting
 * lexicon leaves the store as it was.
 */
@ThreadSafe
public class Ingestion {
    private static final Logger log = LoggerFactory.getLogger(Ingestion.class);

    private final WordnetConfig config;
    private final LexicalStore store;
    private final ProjectIndex projects;
    private final Downloader downloader;
    private final ArchiveExtractor extractor;
    private final LmfParser parser;
    private final Exporter exporter;
    private final IngestionMetrics metrics;

    public Ingestion(WordnetConfig config, LexicalStore store, ProjectIndex projects, Downloader downloader,
                     ArchiveExtractor extractor, LmfParser parser, Exporter exporter, IngestionMetrics metrics) {
        this.config = config;
        this.store = store;
        this.projects = projects;
        this.downloader = downloader;
        this.extractor = extractor;
        this.parser = parser;
        this.exporter = exporter;
        this.metrics = metrics;
    }

    /**
     * Fetch a project into the download cache.
     *
     * @param specifier {@code id:version}, or {@code id} for its first
     *      listed version
     * @return the cached resource
     * @throws UnknownProjectException if the project isn't indexed
     * @throws DownloadException if no url of the project could be fetched
     */
    public Path download(String specifier, DownloadOptions options) throws DownloadException {
        ProjectInfo project = projects.resolve(specifier);
        log.info("Downloading {}", project.specifier());
        return downloader.download(project, options);
    }

    /**
     * Extract an archive and locate its payload.
     *
     * @throws ArchiveException if it can't be extracted or holds no payload
     */
    public List<Path> extract(Path archive) {
        return extractor.extractPayloads(archive);
    }

    /**
     * Add the lexicons and ILI entries of a source: a WN-LMF file, an ILI
     * {@code .tsv} file, an archive holding any number of them or a
     * directory holding them.
     *
     * @return ids of the lexicons added
     * @throws LmfParseException if a source is malformed, nothing is written
     * @throws LexiconConflictException if a lexicon is already installed and
     *      the options don't force replacing it, nothing is written
     */
    public List<String> add(Path source, AddOptions options) throws IOException {
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        List<Path> payloads = payloads(source);
        List<LmfDocument> documents = new ArrayList<>();
        List<Path> documentSources = new ArrayList<>();
        List<IliEntry> ilis = new ArrayList<>();
        for (int i = 0; i < payloads.size(); i++) {
            Path payload = payloads.get(i);
            try (Timer.Context ignored = metrics.timeParse()) {
                if (IliLoader.isIliFile(payload)) {
                    ilis.addAll(IliLoader.load(payload));
                } else {
                    ParseOptions parseOptions = ParseOptions.builder()
                            .progress(scaled(options.getProgress(), i, payloads.size()))
                            .build();
                    documents.add(parser.parse(payload, parseOptions));
                    documentSources.add(payload);
                }
            }
            report(options.getProgress(), (i + 1.0) / payloads.size());
        }

        List<String> added;
        try (Timer.Context ignored = metrics.timeCommit()) {
            added = store.add(documents, ilis, options.isForce());
        }
        metrics.added(added.size());
        metrics.ilisLoaded(ilis.size());
        for (int i = 0; i < documents.size(); i++) {
            for (Lexicon lexicon : documents.get(i).getLexicons()) {
                retainSource(lexicon.getId(), documentSources.get(i));
            }
        }
        log.info("Added {} lexicons {} and {} ILI entries from {}", added.size(), added, ilis.size(), source);
        return added;
    }

    /**
     * Download, extract and add a project.
     */
    public List<String> install(String specifier, DownloadOptions downloadOptions, AddOptions addOptions)
            throws DownloadException, IOException {
        Path resource = download(specifier, downloadOptions);
        return add(resource, addOptions);
    }

    /**
     * Remove a lexicon, everything it owns and its retained source. ILI
     * entries stay.
     *
     * @throws LexiconNotFoundException if no lexicon has that id
     */
    public Lexicon remove(String lexiconId) {
        Lexicon removed;
        try (Timer.Context ignored = metrics.timeCommit()) {
            removed = store.remove(lexiconId);
        }
        metrics.removed();
        Path retained = config.sourcesDirectory().resolve(lexiconId);
        try {
            FileUtils.deleteDirectory(retained.toFile());
        } catch (IOException e) {
            log.warn("Lexicon {} removed but its source in {} could not be deleted", lexiconId, retained, e);
        }
        log.info("Removed lexicon {}", removed.specifier());
        return removed;
    }

    /**
     * Export to the file named by the options.
     *
     * @return the exported lexicons
     */
    public List<Lexicon> export(ExportOptions options) throws IOException {
        Path output = options.getOutput();
        if (output == null) {
            throw new IllegalArgumentException("No output file to export to");
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(output))) {
            return exporter.export(options, out);
        }
    }

    /**
     * Export to a stream, which is left open.
     */
    public List<Lexicon> export(ExportOptions options, OutputStream out) throws IOException {
        return exporter.export(options, out);
    }

    private List<Path> payloads(Path source) {
        if (Files.isDirectory(source)) {
            List<Path> payloads = extractor.payloads(source);
            if (payloads.isEmpty()) {
                throw new ArchiveException("No payload found in " + source);
            }
            return payloads;
        }
        if (ArchiveExtractor.isArchive(source)) {
            return extractor.extractPayloads(source);
        }
        return Collections.singletonList(source);
    }

    private void retainSource(String lexiconId, Path payload) {
        Path directory = config.sourcesDirectory().resolve(lexiconId);
        try {
            FileUtils.deleteDirectory(directory.toFile());
            FileUtils.copyFileToDirectory(payload.toFile(), directory.toFile());
        } catch (IOException e) {
            log.warn("Lexicon {} added but its source could not be retained in {}", lexiconId, directory, e);
        }
    }

    @Nullable
    private static DoubleConsumer scaled(@Nullable DoubleConsumer progress, int index, int count) {
        if (progress == null) {
            return null;
        }
        return fraction -> progress.accept((index + fraction) / count);
    }

    private static void report(@Nullable DoubleConsumer progress, double fraction) {
        if (progress != null) {
            progress.accept(fraction);
        }
    }
}
