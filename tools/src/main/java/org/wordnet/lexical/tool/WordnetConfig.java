package org.wordnet.lexical.tool;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Properties;

import javax.annotation.Nullable;

import org.wordnet.lexical.common.exception.ConfigurationException;
import org.wordnet.lexical.lmf.LmfParsers;
import org.wordnet.lexical.lmf.ParserStrategy;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import lombok.Builder;
import lombok.Value;

/**
 * Settings of a {@link WordnetSession}.
 *
 * <p>Every setting has a default that can be overridden with a {@code wn.*}
 * system property, see {@link #fromProperties(Properties)}. Nothing here is
 * global: two sessions built from two configurations never share state.
 */
@Value
@Builder(toBuilder = true)
public class WordnetConfig {
    public static final String PROPERTY_PREFIX = "wn.";
    public static final String DEFAULT_USER_AGENT = "Lexical Database Downloader";
    public static final Duration DEFAULT_WRITE_LOCK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofMinutes(5);
    public static final List<String> DEFAULT_PAYLOAD_SUFFIXES = ImmutableList.of(".xml", ".tsv");

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    /** Root of downloads, extraction scratch space, store and retained sources. */
    @Builder.Default
    Path dataDirectory = Paths.get(System.getProperty("user.home"), ".wn_data");
    @Builder.Default
    ParserStrategy parserStrategy = ParserStrategy.AUTO;
    /** Size under which {@link ParserStrategy#AUTO} parses into a tree. */
    @Builder.Default
    long domThreshold = LmfParsers.DEFAULT_DOM_THRESHOLD;
    /** How long a write waits for another writer before failing. */
    @Builder.Default
    Duration writeLockTimeout = DEFAULT_WRITE_LOCK_TIMEOUT;
    /** Default bound on one download, callers may pass their own. */
    @Builder.Default
    Duration downloadTimeout = DEFAULT_DOWNLOAD_TIMEOUT;
    /** File suffixes recognized as payload when scanning extracted archives. */
    @Builder.Default
    List<String> payloadSuffixes = DEFAULT_PAYLOAD_SUFFIXES;
    @Builder.Default
    String userAgent = DEFAULT_USER_AGENT;
    /** Fall back to morphological analysis when a form has no exact match. */
    @Builder.Default
    boolean lemmatize = true;

    /**
     * Defaults overridden by the current system properties.
     */
    public static WordnetConfig defaults() {
        return fromProperties(System.getProperties());
    }

    /**
     * Defaults overridden by {@code wn.dataDirectory}, {@code wn.parser},
     * {@code wn.domThreshold}, {@code wn.writeLockTimeout},
     * {@code wn.downloadTimeout} (ISO-8601 durations such as {@code PT30S}),
     * {@code wn.payloadSuffixes} (comma separated), {@code wn.userAgent} and
     * {@code wn.lemmatize}.
     *
     * @throws ConfigurationException if a property can't be parsed
     */
    public static WordnetConfig fromProperties(Properties properties) {
        WordnetConfigBuilder builder = builder();
        String dataDirectory = property(properties, "dataDirectory");
        if (dataDirectory != null) {
            builder.dataDirectory(expandHome(dataDirectory));
        }
        String parser = property(properties, "parser");
        if (parser != null) {
            try {
                builder.parserStrategy(ParserStrategy.fromName(parser));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid " + PROPERTY_PREFIX + "parser: " + parser, e);
            }
        }
        String domThreshold = property(properties, "domThreshold");
        if (domThreshold != null) {
            try {
                builder.domThreshold(Long.parseLong(domThreshold.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid " + PROPERTY_PREFIX + "domThreshold: " + domThreshold, e);
            }
        }
        String writeLockTimeout = property(properties, "writeLockTimeout");
        if (writeLockTimeout != null) {
            builder.writeLockTimeout(duration("writeLockTimeout", writeLockTimeout));
        }
        String downloadTimeout = property(properties, "downloadTimeout");
        if (downloadTimeout != null) {
            builder.downloadTimeout(duration("downloadTimeout", downloadTimeout));
        }
        String payloadSuffixes = property(properties, "payloadSuffixes");
        if (payloadSuffixes != null) {
            builder.payloadSuffixes(ImmutableList.copyOf(LIST_SPLITTER.split(payloadSuffixes)));
        }
        String userAgent = property(properties, "userAgent");
        if (userAgent != null) {
            builder.userAgent(userAgent);
        }
        String lemmatize = property(properties, "lemmatize");
        if (lemmatize != null) {
            builder.lemmatize(Boolean.parseBoolean(lemmatize.trim()));
        }
        return builder.build();
    }

    /**
     * Defaults, overridden by system properties, but rooted in
     * {@code dataDirectory}.
     */
    public static WordnetConfig forDirectory(Path dataDirectory) {
        return defaults().toBuilder().dataDirectory(dataDirectory).build();
    }

    public Path downloadDirectory() {
        return dataDirectory.resolve("downloads");
    }

    public Path extractDirectory() {
        return dataDirectory.resolve("extracted");
    }

    public Path storeDirectory() {
        return dataDirectory.resolve("store");
    }

    public Path sourcesDirectory() {
        return dataDirectory.resolve("sources");
    }

    /** Project index extending the bundled one, may not exist. */
    public Path userIndex() {
        return dataDirectory.resolve("index.toml");
    }

    @Nullable
    private static String property(Properties properties, String name) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value;
    }

    private static Duration duration(String name, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }
}
