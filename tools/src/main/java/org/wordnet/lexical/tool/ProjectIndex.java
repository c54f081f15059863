package org.wordnet.lexical.tool;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.ConfigurationException;
import org.wordnet.lexical.common.exception.UnknownProjectException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Catalog of downloadable projects.
 *
 * <p>The index bundled with this library is extended by an optional
 * {@code index.toml} in the data directory. A project declared there
 * replaces the bundled project of the same id. Both use the same layout:
 * <pre>
 * [oewn]
 *   label = "Open English WordNet"
 *   language = "en"
 *   [oewn.versions.2024]
 *     url = "https://first.example/oewn.xml.gz https://mirror.example/oewn.xml.gz"
 * </pre>
 * A project or a version may carry an {@code error} instead of urls, it is
 * reported when the project is resolved.
 */
public class ProjectIndex {
    private static final Logger log = LoggerFactory.getLogger(ProjectIndex.class);

    static final String BUNDLED_INDEX = "index.toml";

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private static final TypeReference<LinkedHashMap<String, ProjectEntry>> INDEX_TYPE =
            new TypeReference<LinkedHashMap<String, ProjectEntry>>() { };
    private static final Splitter URL_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final Map<String, ProjectEntry> projects;

    ProjectIndex(Map<String, ProjectEntry> projects) {
        this.projects = Collections.unmodifiableMap(new LinkedHashMap<>(projects));
    }

    /**
     * The bundled index extended by {@code userIndex} when it exists.
     *
     * @throws ConfigurationException if an index can't be read
     */
    public static ProjectIndex load(Path userIndex) {
        Map<String, ProjectEntry> projects = bundled();
        if (Files.isRegularFile(userIndex)) {
            try (InputStream in = Files.newInputStream(userIndex)) {
                Map<String, ProjectEntry> user = read(in);
                log.info("Loaded {} projects from {}", user.size(), userIndex);
                projects.putAll(user);
            } catch (IOException e) {
                throw new ConfigurationException("Unable to read project index " + userIndex, e);
            }
        }
        return new ProjectIndex(projects);
    }

    /**
     * The bundled index alone.
     */
    public static ProjectIndex bundledOnly() {
        return new ProjectIndex(bundled());
    }

    public Set<String> ids() {
        return projects.keySet();
    }

    /**
     * Versions of a project, in index order, empty for unknown projects.
     */
    public List<String> versions(String id) {
        ProjectEntry project = projects.get(id);
        if (project == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(project.getVersions().keySet());
    }

    /**
     * Resolve {@code id:version}. Without a version, or with {@code *}, the
     * first version listed is used.
     *
     * @throws UnknownProjectException if the project or version isn't
     *      indexed, or is indexed with an error
     * @throws ConfigurationException if the index entry is malformed
     */
    public ProjectInfo resolve(String specifier) {
        int colon = specifier.indexOf(':');
        String id = (colon < 0 ? specifier : specifier.substring(0, colon)).trim();
        String version = colon < 0 ? null : specifier.substring(colon + 1).trim();

        ProjectEntry project = projects.get(id);
        if (project == null) {
            throw new UnknownProjectException("No such project id: " + id);
        }
        if (project.getError() != null) {
            throw new UnknownProjectException(project.getError());
        }
        Map<String, VersionEntry> versions = project.getVersions();
        if (version == null || version.isEmpty() || "*".equals(version)) {
            if (versions.isEmpty()) {
                throw new UnknownProjectException("No versions available for " + id);
            }
            version = versions.keySet().iterator().next();
        }
        VersionEntry entry = versions.get(version);
        if (entry == null) {
            throw new UnknownProjectException("No such version: '" + version + "' (" + id + ")");
        }
        if (entry.getUrl() != null && entry.getError() != null) {
            throw new ConfigurationException(id + ":" + version + " specifies both url and error");
        }
        if (entry.getError() != null) {
            throw new UnknownProjectException(entry.getError());
        }
        if (entry.getUrl() == null) {
            throw new UnknownProjectException("No resource url for " + id + ":" + version);
        }

        ProjectInfo.ProjectInfoBuilder info = ProjectInfo.builder()
                .id(id)
                .version(version)
                .label(project.getLabel())
                .language(project.getLanguage())
                .license(entry.getLicense() != null ? entry.getLicense() : project.getLicense());
        if (project.getType() != null) {
            info.type(project.getType());
        }
        for (String url : URL_SPLITTER.split(entry.getUrl())) {
            try {
                info.resourceUrl(URI.create(url));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid url for " + id + ":" + version + ": " + url, e);
            }
        }
        return info.build();
    }

    private static Map<String, ProjectEntry> bundled() {
        URL resource = Resources.getResource(ProjectIndex.class, BUNDLED_INDEX);
        try (InputStream in = resource.openStream()) {
            return read(in);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read bundled project index", e);
        }
    }

    private static Map<String, ProjectEntry> read(InputStream in) throws IOException {
        Map<String, ProjectEntry> projects = MAPPER.readValue(in, INDEX_TYPE);
        return projects == null ? new LinkedHashMap<>() : projects;
    }

    @Value
    @Builder
    @Jacksonized
    static class ProjectEntry {
        @Nullable
        String type;
        @Nullable
        String label;
        @Nullable
        String language;
        @Nullable
        String license;
        @Nullable
        String error;
        @Builder.Default
        LinkedHashMap<String, VersionEntry> versions = new LinkedHashMap<>();
    }

    @Value
    @Builder
    @Jacksonized
    static class VersionEntry {
        @Nullable
        String url;
        @Nullable
        String error;
        @Nullable
        String license;
    }
}
