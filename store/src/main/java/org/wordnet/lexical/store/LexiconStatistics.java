package org.wordnet.lexical.store;

import lombok.Value;

@Value
public class LexiconStatistics {
    String lexiconId;
    String label;
    String language;
    String version;
    long wordCount;
    long synsetCount;
}
