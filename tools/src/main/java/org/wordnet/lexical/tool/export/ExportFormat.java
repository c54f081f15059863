package org.wordnet.lexical.tool.export;

import java.util.Locale;

public enum ExportFormat {
    /** WN-LMF XML, can be added back. */
    LMF,
    /** Lexicon metadata with its words, senses and synsets. */
    JSON,
    /** One row per sense. */
    CSV;

    public static ExportFormat fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("XML".equals(normalized)) {
            return LMF;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + name, e);
        }
    }
}
