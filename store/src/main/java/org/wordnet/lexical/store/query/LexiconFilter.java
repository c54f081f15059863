package org.wordnet.lexical.store.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import org.wordnet.lexical.common.model.Lexicon;

import com.google.common.base.Splitter;

import lombok.Value;

/**
 * Selection of installed lexicons: {@code *} for all of them or a space
 * separated list of {@code id} and {@code id:version} entries.
 */
public final class LexiconFilter {
    public static final String ALL_SPECIFIER = "*";
    public static final LexiconFilter ALL = new LexiconFilter(ALL_SPECIFIER, Collections.emptyList());

    private static final Splitter SPLITTER = Splitter.on(' ').trimResults().omitEmptyStrings();

    private final String specifier;
    private final List<Entry> entries;

    private LexiconFilter(String specifier, List<Entry> entries) {
        this.specifier = specifier;
        this.entries = entries;
    }

    /**
     * Parse a filter. A {@code null} or blank specifier, or one containing
     * {@code *}, selects every lexicon.
     */
    public static LexiconFilter parse(@Nullable String specifier) {
        if (specifier == null) {
            return ALL;
        }
        List<Entry> entries = new ArrayList<>();
        for (String part : SPLITTER.split(specifier)) {
            if (ALL_SPECIFIER.equals(part)) {
                return ALL;
            }
            int colon = part.indexOf(':');
            if (colon < 0) {
                entries.add(new Entry(part, null));
            } else {
                String id = part.substring(0, colon);
                String version = part.substring(colon + 1);
                if (id.isEmpty()) {
                    throw new IllegalArgumentException("Invalid lexicon specifier: " + part);
                }
                entries.add(new Entry(id, version.isEmpty() || ALL_SPECIFIER.equals(version) ? null : version));
            }
        }
        if (entries.isEmpty()) {
            return ALL;
        }
        return new LexiconFilter(specifier.trim(), Collections.unmodifiableList(entries));
    }

    public static LexiconFilter of(String... lexiconIds) {
        return parse(String.join(" ", lexiconIds));
    }

    public boolean isAll() {
        return entries.isEmpty();
    }

    public boolean matches(Lexicon lexicon) {
        if (isAll()) {
            return true;
        }
        for (Entry entry : entries) {
            if (entry.id.equals(lexicon.getId())
                    && (entry.version == null || entry.version.equals(lexicon.getVersion()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * The matching lexicons, keeping the order of {@code installed}.
     */
    public List<Lexicon> select(List<Lexicon> installed) {
        if (isAll()) {
            return installed;
        }
        List<Lexicon> selected = new ArrayList<>();
        for (Lexicon lexicon : installed) {
            if (matches(lexicon)) {
                selected.add(lexicon);
            }
        }
        return selected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return entries.equals(((LexiconFilter) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return specifier;
    }

    @Value
    private static class Entry {
        String id;
        @Nullable
        String version;
    }
}
