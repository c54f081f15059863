package org.wordnet.lexical.tool;

import java.net.URI;
import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One version of a project of the index, resolved to downloadable resources.
 */
@Value
@Builder
public class ProjectInfo {
    public static final String TYPE_WORDNET = "wordnet";
    public static final String TYPE_ILI = "ili";

    String id;
    String version;
    @Builder.Default
    String type = TYPE_WORDNET;
    @Nullable
    String label;
    @Nullable
    String language;
    @Nullable
    String license;
    /** Alternative locations of the same resource, tried in order. */
    @Singular
    List<URI> resourceUrls;

    public String specifier() {
        return id + ":" + version;
    }

    public boolean isIli() {
        return TYPE_ILI.equals(type);
    }
}
