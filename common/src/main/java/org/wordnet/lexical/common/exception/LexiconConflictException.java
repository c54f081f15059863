package org.wordnet.lexical.common.exception;

/**
 * A lexicon with the same id is already installed and replacing it wasn't
 * requested.
 */
public class LexiconConflictException extends ContainedException {
    private final String lexiconId;

    public LexiconConflictException(String lexiconId, String installedVersion) {
        super("Lexicon " + lexiconId + ":" + installedVersion + " is already installed, use force to replace it");
        this.lexiconId = lexiconId;
    }

    public String getLexiconId() {
        return lexiconId;
    }
}
