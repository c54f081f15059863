package org.wordnet.lexical.common.exception;

public class LexiconNotFoundException extends ContainedException {
    private final String lexiconId;

    public LexiconNotFoundException(String lexiconId) {
        super("Lexicon " + lexiconId + " is not installed");
        this.lexiconId = lexiconId;
    }

    public String getLexiconId() {
        return lexiconId;
    }
}
