package org.wordnet.lexical.lmf;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;

import lombok.Value;

/**
 * Whole document model, as built by {@link DocumentCollector}.
 */
@Value
public class LmfDocument {
    String lmfVersion;
    List<Lexicon> lexicons;
    List<Word> words;
    List<Sense> senses;
    List<Synset> synsets;
    /** ILI ids referenced by synsets, in order of first reference. */
    Set<String> iliRefs;

    /**
     * Entity-set equality: the same lexicons, words, senses, synsets and ILI
     * references regardless of the order they were emitted in.
     */
    public boolean sameEntities(LmfDocument other) {
        return new HashSet<>(lexicons).equals(new HashSet<>(other.lexicons))
                && new HashSet<>(words).equals(new HashSet<>(other.words))
                && new HashSet<>(senses).equals(new HashSet<>(other.senses))
                && new HashSet<>(synsets).equals(new HashSet<>(other.synsets))
                && iliRefs.equals(other.iliRefs);
    }
}
