package org.wordnet.lexical.common;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed part-of-speech vocabulary of WN-LMF.
 */
public enum PartOfSpeech {
    NOUN("n"),
    VERB("v"),
    ADJECTIVE("a"),
    /** Adjective satellite, clustered around a head adjective. */
    ADJECTIVE_SATELLITE("s"),
    ADVERB("r");

    private final String tag;

    PartOfSpeech(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Parse the single letter tag used in LMF documents.
     *
     * @throws IllegalArgumentException if the tag isn't one of n, v, a, s, r
     */
    @JsonCreator
    public static PartOfSpeech fromTag(String tag) {
        PartOfSpeech pos = lookup(tag);
        if (pos == null) {
            throw new IllegalArgumentException("Invalid part of speech: " + tag);
        }
        return pos;
    }

    /**
     * Like {@link #fromTag(String)} but returns null for unknown tags. Tags
     * are lower case, {@code N} is not a noun.
     */
    @Nullable
    public static PartOfSpeech lookup(@Nullable String tag) {
        if (tag == null) {
            return null;
        }
        switch (tag) {
            case "n": return NOUN;
            case "v": return VERB;
            case "a": return ADJECTIVE;
            case "s": return ADJECTIVE_SATELLITE;
            case "r": return ADVERB;
            default: return null;
        }
    }

    /**
     * Satellites are adjectives for lookup purposes.
     */
    public boolean matches(@Nullable PartOfSpeech filter) {
        if (filter == null || filter == this) {
            return true;
        }
        return filter == ADJECTIVE && this == ADJECTIVE_SATELLITE;
    }
}
