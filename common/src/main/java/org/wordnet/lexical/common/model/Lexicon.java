package org.wordnet.lexical.common.model;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Metadata of a lexicon. A lexicon is identified by its id alone: a store
 * holds at most one version of it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Lexicon {
    String id;
    String label;
    /** BCP-47 language tag. */
    String language;
    String version;
    @Nullable
    String email;
    @Nullable
    String license;
    @Nullable
    String url;
    @Nullable
    String citation;
    @Nullable
    String logo;

    /**
     * The {@code id:version} specifier of this lexicon.
     */
    public String specifier() {
        return id + ":" + version;
    }
}
