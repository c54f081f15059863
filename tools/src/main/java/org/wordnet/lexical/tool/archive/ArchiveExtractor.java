package org.wordnet.lexical.tool.archive;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.annotation.Nullable;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.ArchiveException;

import com.google.common.collect.ImmutableList;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Unpacks downloaded resources into the extraction scratch area.
 *
 * <p>Every extraction gets a fresh directory {@code <name>-<n>} where
 * {@code name} is the archive name without its archive suffix. Tar archives
 * are unpacked whole. A single compressed file is decompressed alone into
 * its directory.
 */
public class ArchiveExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private enum Format {
        TAR_XZ(".tar.xz", true),
        TXZ(".txz", true),
        TAR_GZ(".tar.gz", true),
        TGZ(".tgz", true),
        TAR_BZ2(".tar.bz2", true),
        TBZ2(".tbz2", true),
        TAR(".tar", true),
        XZ(".xz", false),
        GZ(".gz", false),
        BZ2(".bz2", false);

        private final String suffix;
        private final boolean tar;

        Format(String suffix, boolean tar) {
            this.suffix = suffix;
            this.tar = tar;
        }

        @Nullable
        static Format of(Path file) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            // Declaration order puts compound suffixes first.
            for (Format format : values()) {
                if (name.endsWith(format.suffix)) {
                    return format;
                }
            }
            return null;
        }

        String stripSuffix(String name) {
            return name.substring(0, name.length() - suffix.length());
        }

        InputStream decompress(InputStream in) throws IOException {
            switch (this) {
                case TAR_XZ:
                case TXZ:
                case XZ:
                    return new XZCompressorInputStream(in);
                case TAR_GZ:
                case TGZ:
                case GZ:
                    return new GzipCompressorInputStream(in, true);
                case TAR_BZ2:
                case TBZ2:
                case BZ2:
                    return new BZip2CompressorInputStream(in);
                default:
                    return in;
            }
        }
    }

    private final Path extractDirectory;
    private final List<String> payloadSuffixes;

    public ArchiveExtractor(Path extractDirectory, List<String> payloadSuffixes) {
        this.extractDirectory = extractDirectory;
        this.payloadSuffixes = payloadSuffixes.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Whether the file is in one of the archive or compression formats
     * handled here.
     */
    public static boolean isArchive(Path file) {
        return Format.of(file) != null;
    }

    /**
     * Extract an archive into a new directory.
     *
     * @return the directory holding the extracted files
     * @throws ArchiveException if the archive is corrupt or an entry would be
     *      written outside the extraction directory
     * @throws IllegalArgumentException if the file isn't an archive
     */
    public Path extract(Path archive) {
        Format format = Format.of(archive);
        if (format == null) {
            throw new IllegalArgumentException("Not a supported archive: " + archive);
        }
        String name = format.stripSuffix(archive.getFileName().toString());
        Path target;
        try {
            target = newDirectory(name.isEmpty() ? "archive" : name);
            try (InputStream in = format.decompress(new BufferedInputStream(Files.newInputStream(archive)))) {
                if (format.tar) {
                    untar(in, target);
                } else {
                    Files.copy(in, target.resolve(name));
                }
            }
        } catch (IOException e) {
            throw new ArchiveException("Unable to extract " + archive + ": " + e.getMessage(), e);
        }
        log.info("Extracted {} into {}", archive, target);
        return target;
    }

    /**
     * Extract an archive and locate its payload files.
     *
     * @throws ArchiveException if the archive holds no payload
     */
    public List<Path> extractPayloads(Path archive) {
        Path directory = extract(archive);
        List<Path> payloads = payloads(directory);
        if (payloads.isEmpty()) {
            throw new ArchiveException("No payload (" + String.join(", ", payloadSuffixes) + ") found in " + archive);
        }
        return payloads;
    }

    /**
     * Files under {@code directory}, at any depth, whose name ends with one
     * of the payload suffixes. Sorted by path.
     */
    public List<Path> payloads(Path directory) {
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(this::isPayload)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveException("Unable to scan " + directory + ": " + e.getMessage(), e);
        }
    }

    private boolean isPayload(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.startsWith(".")) {
            return false;
        }
        return payloadSuffixes.stream().anyMatch(name::endsWith);
    }

    private Path newDirectory(String name) throws IOException {
        Files.createDirectories(extractDirectory);
        for (int n = 1; ; n++) {
            Path candidate = extractDirectory.resolve(name + "-" + n);
            if (!Files.exists(candidate)) {
                return Files.createDirectory(candidate);
            }
        }
    }

    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "entries resolving outside of target are rejected")
    private static void untar(InputStream in, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        TarArchiveInputStream tar = new TarArchiveInputStream(in);
        TarArchiveEntry entry;
        while ((entry = tar.getNextTarEntry()) != null) {
            Path destination = root.resolve(entry.getName()).normalize();
            if (!destination.startsWith(root)) {
                throw new ArchiveException("Archive entry " + entry.getName() + " escapes " + target);
            }
            if (entry.isDirectory()) {
                Files.createDirectories(destination);
            } else if (entry.isFile()) {
                Files.createDirectories(destination.getParent());
                Files.copy(tar, destination, StandardCopyOption.REPLACE_EXISTING);
            } else {
                log.debug("Skipping archive entry {} of type {}", entry.getName(),
                        entry.isSymbolicLink() ? "symlink" : "special");
            }
        }
    }
}
