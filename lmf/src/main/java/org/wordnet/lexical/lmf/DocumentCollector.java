package org.wordnet.lexical.lmf;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Collects every entity of a document in memory.
 */
@NotThreadSafe
public class DocumentCollector implements LmfHandler {
    private String lmfVersion;
    private final List<Lexicon> lexicons = new ArrayList<>();
    private final List<Word> words = new ArrayList<>();
    private final List<Sense> senses = new ArrayList<>();
    private final List<Synset> synsets = new ArrayList<>();
    private final Set<String> iliRefs = new LinkedHashSet<>();

    @Override
    public void startDocument(String lmfVersion) {
        this.lmfVersion = lmfVersion;
    }

    @Override
    public void entry(Word word, List<Sense> entrySenses) {
        words.add(word);
        senses.addAll(entrySenses);
    }

    @Override
    public void synset(Synset synset) {
        synsets.add(synset);
        if (synset.hasIli()) {
            iliRefs.add(synset.getIli());
        }
    }

    @Override
    public void endLexicon(Lexicon lexicon) {
        lexicons.add(lexicon);
    }

    public LmfDocument getDocument() {
        if (lmfVersion == null) {
            throw new IllegalStateException("No document was parsed");
        }
        return new LmfDocument(lmfVersion, ImmutableList.copyOf(lexicons), ImmutableList.copyOf(words),
                ImmutableList.copyOf(senses), ImmutableList.copyOf(synsets), ImmutableSet.copyOf(iliRefs));
    }
}
