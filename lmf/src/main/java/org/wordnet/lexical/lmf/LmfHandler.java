package org.wordnet.lexical.lmf;

import java.util.List;

import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;

/**
 * Receives entities as a parser completes them. Entries arrive when their
 * {@code LexicalEntry} element closes, synsets when their {@code Synset}
 * element closes. {@link #endLexicon(Lexicon)} is only called once every
 * cross reference of the lexicon has been checked.
 */
public interface LmfHandler {
    default void startDocument(String lmfVersion) {
    }

    default void startLexicon(Lexicon lexicon) {
    }

    void entry(Word word, List<Sense> senses);

    void synset(Synset synset);

    default void endLexicon(Lexicon lexicon) {
    }

    default void endDocument() {
    }
}
